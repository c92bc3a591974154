package io.b2mash.ordermetrics.kpi;

import static io.b2mash.ordermetrics.kpi.OrderInputNormalizer.orZero;

import io.b2mash.ordermetrics.source.ProcurementKind;
import io.b2mash.ordermetrics.source.ProcurementRow;
import io.b2mash.ordermetrics.source.WorkerTimeLogRow;
import java.util.List;

/**
 * Computes the KPI of a single order from its normalized fields and its procurement and time-log
 * rows. Pure and deterministic; child rows belonging to another order are ignored.
 *
 * <p>Rules:
 *
 * <ol>
 *   <li>material cost = qty * estimated material cost + Σ qty * unit price of received purchases
 *   <li>actual hours = Σ qty * time per unit of every manufacture step (whatever its status) + Σ
 *       qty * time per unit of every worker time log
 *   <li>actual time per unit = actual hours / qty, 0 when qty is 0
 *   <li>labor cost = wage rate * actual hours
 *   <li>gross profit = sales - (material cost + labor cost)
 *   <li>variance % = (actual - standard) / standard * 100, undefined without a standard time
 * </ol>
 */
public final class OrderKpiCalculator {

  public static final double DEFAULT_WAGE_RATE = 2000;

  private final double wageRate;

  public OrderKpiCalculator(double wageRate) {
    if (!(wageRate >= 0) || Double.isInfinite(wageRate)) {
      throw new IllegalArgumentException("Wage rate must be a finite non-negative number");
    }
    this.wageRate = wageRate;
  }

  public OrderKpi calculate(
      NormalizedOrder order,
      List<ProcurementRow> procurements,
      List<WorkerTimeLogRow> workerLogs) {
    double baseMaterialCost = order.qty() * order.estimatedMaterialCost();

    double purchaseMaterialCost = 0;
    double manufactureHours = 0;
    for (ProcurementRow procurement : procurements) {
      if (!order.orderId().equals(procurement.orderId())) {
        continue;
      }
      if (procurement.isKind(ProcurementKind.PURCHASE)) {
        // Committed but unreceived purchases are not spend yet
        if (procurement.isCompleted()) {
          purchaseMaterialCost += orZero(procurement.qty()) * orZero(procurement.unitPrice());
        }
      } else if (procurement.isKind(ProcurementKind.MANUFACTURE)) {
        manufactureHours += orZero(procurement.qty()) * orZero(procurement.actTimePerUnit());
      }
    }

    double workerLogHours = 0;
    for (WorkerTimeLogRow workerLog : workerLogs) {
      if (order.orderId().equals(workerLog.orderId())) {
        workerLogHours += orZero(workerLog.qty()) * orZero(workerLog.actTimePerUnit());
      }
    }

    double materialCost = baseMaterialCost + purchaseMaterialCost;
    double totalActualHours = manufactureHours + workerLogHours;
    double actualTimePerUnit = order.qty() > 0 ? totalActualHours / order.qty() : 0;
    double laborCost = wageRate * totalActualHours;
    double grossProfit = order.sales() - (materialCost + laborCost);
    Double variancePct =
        order.hasStandardTime()
            ? ((actualTimePerUnit - order.stdTimePerUnit()) / order.stdTimePerUnit()) * 100
            : null;

    return new OrderKpi(
        order.orderId(),
        order.productName(),
        order.qty(),
        order.dueDate(),
        order.sales(),
        order.estimatedMaterialCost(),
        order.stdTimePerUnit(),
        order.status(),
        order.customerName(),
        materialCost,
        laborCost,
        grossProfit,
        actualTimePerUnit,
        variancePct);
  }
}
