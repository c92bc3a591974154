package io.b2mash.ordermetrics.kpi;

/**
 * Canonical order input for the KPI calculator: every numeric field resolved, due date either an
 * ISO string or the empty marker, customer name still optional.
 *
 * @param dueDate due date as stored, or {@link OrderInputNormalizer#NO_DUE_DATE} when absent
 * @param customerName null when the order carries no customer
 */
public record NormalizedOrder(
    String orderId,
    String productName,
    double qty,
    String dueDate,
    double sales,
    double estimatedMaterialCost,
    double stdTimePerUnit,
    String status,
    String customerName) {

  public boolean hasDueDate() {
    return !dueDate.isEmpty();
  }

  /** A positive standard time per unit; without one the time variance is undefined. */
  public boolean hasStandardTime() {
    return stdTimePerUnit > 0;
  }
}
