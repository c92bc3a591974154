package io.b2mash.ordermetrics.source;

/**
 * One {@code procurements} row. Purchases use {@code unitPrice} and {@code receivedAt};
 * manufacture steps use {@code actTimePerUnit} and {@code completedAt}. Timestamps stay as stored
 * text.
 */
public record ProcurementRow(
    long id,
    String orderId,
    String kind,
    String itemName,
    Double qty,
    Double unitPrice,
    Double actTimePerUnit,
    String status,
    String eta,
    String receivedAt,
    String completedAt) {

  public boolean isKind(ProcurementKind candidate) {
    return candidate.dbValue().equals(kind);
  }

  /** True once a purchase is received or a manufacture step is done. */
  public boolean isCompleted() {
    for (ProcurementKind candidate : ProcurementKind.values()) {
      if (isKind(candidate)) {
        return candidate.terminalStatus().equals(status);
      }
    }
    return false;
  }
}
