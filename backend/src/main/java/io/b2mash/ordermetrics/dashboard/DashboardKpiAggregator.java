package io.b2mash.ordermetrics.dashboard;

import io.b2mash.ordermetrics.kpi.OrderKpi;
import io.b2mash.ordermetrics.source.ProcurementKind;
import io.b2mash.ordermetrics.source.ProcurementRow;
import java.util.List;

/**
 * Pure reduction of order KPIs and their procurements into a {@link DashboardKpi}. No Spring
 * dependencies, no side effects.
 *
 * <p>Orders without a defined time variance are left out of the average rather than counted as 0.
 * An order whose variance is defined and exactly 0 is averaged in; it used to be skipped along with
 * the undefined ones.
 */
public final class DashboardKpiAggregator {

  private DashboardKpiAggregator() {}

  public static DashboardKpi aggregate(List<OrderKpi> kpis, List<ProcurementRow> procurements) {
    double totalSales = 0;
    double totalGrossProfit = 0;
    double totalStdHours = 0;
    double totalActualHours = 0;
    double varianceSum = 0;
    int varianceCount = 0;

    for (OrderKpi kpi : kpis) {
      totalSales += kpi.sales();
      totalGrossProfit += kpi.grossProfit();
      totalStdHours += kpi.qty() * kpi.stdTimePerUnit();
      totalActualHours += kpi.qty() * kpi.actualTimePerUnit();
      if (kpi.hasVariance()) {
        varianceSum += kpi.variancePct();
        varianceCount++;
      }
    }

    return new DashboardKpi(
        totalSales,
        totalGrossProfit,
        totalStdHours,
        totalActualHours,
        varianceCount > 0 ? varianceSum / varianceCount : 0,
        completionRate(procurements, ProcurementKind.PURCHASE),
        completionRate(procurements, ProcurementKind.MANUFACTURE));
  }

  static double completionRate(List<ProcurementRow> procurements, ProcurementKind kind) {
    long total = 0;
    long completed = 0;
    for (ProcurementRow procurement : procurements) {
      if (procurement.isKind(kind)) {
        total++;
        if (procurement.isCompleted()) {
          completed++;
        }
      }
    }
    return total > 0 ? 100.0 * completed / total : 0;
  }
}
