package io.b2mash.ordermetrics.kpi;

import java.util.List;

/** One page of order KPIs. {@code total} counts every order matching the filter. */
public record OrderKpiPage(List<OrderKpi> items, long total, int page, int pageSize) {}
