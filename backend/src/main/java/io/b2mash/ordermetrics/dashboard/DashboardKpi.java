package io.b2mash.ordermetrics.dashboard;

/**
 * Aggregate over a filtered set of orders. Completion rates are percentages in [0, 100] and read 0
 * when there are no procurements of that kind.
 */
public record DashboardKpi(
    double totalSales,
    double totalGrossProfit,
    double totalStdHours,
    double totalActualHours,
    double avgVariancePct,
    double purchaseCompletionRate,
    double manufactureCompletionRate) {}
