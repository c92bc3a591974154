package io.b2mash.ordermetrics.kpi;

import io.b2mash.ordermetrics.source.ProcurementRow;
import java.util.List;

/**
 * KPIs of a set of orders together with the procurement rows they were computed from, so callers
 * that also need completion rates do not read procurements a second time.
 */
public record OrderKpiBatch(List<OrderKpi> kpis, List<ProcurementRow> procurements) {}
