package io.b2mash.ordermetrics.kpi;

/**
 * Derived metrics for one order plus the order fields shown next to them.
 *
 * @param materialCost base estimate plus received purchases
 * @param laborCost wage rate times all recorded hours
 * @param actualTimePerUnit recorded hours divided by quantity, 0 for a zero quantity
 * @param variancePct deviation of actual from standard time per unit in percent; null when the
 *     order has no standard time
 */
public record OrderKpi(
    String orderId,
    String productName,
    double qty,
    String dueDate,
    double sales,
    double estimatedMaterialCost,
    double stdTimePerUnit,
    String status,
    String customerName,
    double materialCost,
    double laborCost,
    double grossProfit,
    double actualTimePerUnit,
    Double variancePct) {

  public boolean hasVariance() {
    return variancePct != null;
  }

  /** Variance as reported to clients, where an undefined variance reads as 0. */
  public double reportedVariancePct() {
    return variancePct != null ? variancePct : 0.0;
  }
}
