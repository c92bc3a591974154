package io.b2mash.ordermetrics.source;

/** The two procurement flavours and the status each one ends in. */
public enum ProcurementKind {
  PURCHASE("purchase", "received"),
  MANUFACTURE("manufacture", "done");

  private final String dbValue;
  private final String terminalStatus;

  ProcurementKind(String dbValue, String terminalStatus) {
    this.dbValue = dbValue;
    this.terminalStatus = terminalStatus;
  }

  public String dbValue() {
    return dbValue;
  }

  public String terminalStatus() {
    return terminalStatus;
  }
}
