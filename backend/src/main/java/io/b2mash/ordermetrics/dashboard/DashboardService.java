package io.b2mash.ordermetrics.dashboard;

import io.b2mash.ordermetrics.kpi.OrderKpiService;
import io.b2mash.ordermetrics.source.OrderQuery;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DashboardService {

  private static final Logger log = LoggerFactory.getLogger(DashboardService.class);

  private final OrderKpiService orderKpiService;

  public DashboardService(OrderKpiService orderKpiService) {
    this.orderKpiService = orderKpiService;
  }

  /** Aggregates every order due within the (optional, inclusive) range. */
  @Transactional(readOnly = true)
  public DashboardKpi computeDashboardKpi(LocalDate from, LocalDate to) {
    OrderKpiService.validateDateRange(from, to);
    var batch = orderKpiService.computeBatch(OrderQuery.dueBetween(from, to));
    var dashboard = DashboardKpiAggregator.aggregate(batch.kpis(), batch.procurements());
    log.debug(
        "Dashboard for {}..{} aggregated {} order(s) and {} procurement(s)",
        from,
        to,
        batch.kpis().size(),
        batch.procurements().size());
    return dashboard;
  }
}
