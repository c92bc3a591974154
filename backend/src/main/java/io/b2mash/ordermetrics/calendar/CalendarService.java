package io.b2mash.ordermetrics.calendar;

import io.b2mash.ordermetrics.kpi.NormalizedOrder;
import io.b2mash.ordermetrics.kpi.OrderInputNormalizer;
import io.b2mash.ordermetrics.kpi.OrderKpiService;
import io.b2mash.ordermetrics.source.KpiSourceRepository;
import io.b2mash.ordermetrics.source.OrderQuery;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Calendar events for orders due in a date range and the procurements of those orders. */
@Service
public class CalendarService {

  private static final Logger log = LoggerFactory.getLogger(CalendarService.class);

  private final KpiSourceRepository repository;
  private final CalendarEventProjector projector;

  public CalendarService(KpiSourceRepository repository, CalendarEventProjector projector) {
    this.repository = repository;
    this.projector = projector;
  }

  @Transactional(readOnly = true)
  public List<CalendarEvent> getCalendarEvents(LocalDate from, LocalDate to) {
    OrderKpiService.validateDateRange(from, to);

    List<NormalizedOrder> orders =
        repository.findOrders(OrderQuery.dueBetween(from, to)).stream()
            .map(OrderInputNormalizer::normalize)
            .toList();
    var procurements =
        repository.findProcurements(orders.stream().map(NormalizedOrder::orderId).toList());

    var events = projector.project(orders, procurements);
    log.debug(
        "Projected {} calendar event(s) from {} order(s) and {} procurement(s)",
        events.size(),
        orders.size(),
        procurements.size());
    return events;
  }
}
