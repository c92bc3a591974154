package io.b2mash.ordermetrics.kpi;

import io.b2mash.ordermetrics.config.OrderMetricsProperties;
import io.b2mash.ordermetrics.exception.InvalidStateException;
import io.b2mash.ordermetrics.source.KpiSourceRepository;
import io.b2mash.ordermetrics.source.OrderQuery;
import io.b2mash.ordermetrics.source.OrderRow;
import io.b2mash.ordermetrics.source.ProcurementRow;
import io.b2mash.ordermetrics.source.WorkerTimeLogRow;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Order KPIs for a single order, a filtered page of orders, or an unpaged export. Child rows are
 * always loaded by the ids of orders that were found, so rows pointing at deleted orders never
 * contribute. Any read failure aborts the whole call.
 */
@Service
public class OrderKpiService {

  private static final Logger log = LoggerFactory.getLogger(OrderKpiService.class);

  private final KpiSourceRepository repository;
  private final OrderKpiCalculator calculator;
  private final OrderMetricsProperties properties;

  public OrderKpiService(
      KpiSourceRepository repository,
      OrderKpiCalculator calculator,
      OrderMetricsProperties properties) {
    this.repository = repository;
    this.calculator = calculator;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public Optional<OrderKpi> getOrderKpi(String orderId) {
    var order = repository.findOrder(orderId);
    if (order.isEmpty()) {
      log.debug("Order {} not found", orderId);
      return Optional.empty();
    }
    var procurements = repository.findProcurements(orderId);
    var workerLogs = repository.findWorkerTimeLogs(orderId);
    return Optional.of(
        calculator.calculate(
            OrderInputNormalizer.normalize(order.get()), procurements, workerLogs));
  }

  @Transactional(readOnly = true)
  public OrderKpiPage listOrderKpis(OrderKpiFilter filter) {
    validateDateRange(filter.from(), filter.to());
    int page = filter.page() != null ? filter.page() : 1;
    if (page < 1) {
      throw new InvalidStateException("Invalid Page", "'page' must be 1 or greater");
    }
    int pageSize = effectivePageSize(filter.pageSize());

    var query = OrderQuery.matching(filter.from(), filter.to(), filter.q());
    long total = repository.countOrders(query);
    var batch = computeBatch(query.page(pageSize, (long) (page - 1) * pageSize));

    log.debug(
        "Listed {} of {} order KPI(s) on page {} (size {})",
        batch.kpis().size(),
        total,
        page,
        pageSize);
    return new OrderKpiPage(batch.kpis(), total, page, pageSize);
  }

  @Transactional(readOnly = true)
  public List<OrderKpi> exportOrderKpis(OrderKpiFilter filter) {
    validateDateRange(filter.from(), filter.to());
    var query = OrderQuery.matching(filter.from(), filter.to(), filter.q());
    return computeBatch(query).kpis();
  }

  /**
   * Computes KPIs for every order the query returns, in the query's order. Procurements and worker
   * logs are read once for the whole batch and grouped by order id.
   */
  @Transactional(readOnly = true)
  public OrderKpiBatch computeBatch(OrderQuery query) {
    List<OrderRow> orders = repository.findOrders(query);
    if (orders.isEmpty()) {
      return new OrderKpiBatch(List.of(), List.of());
    }
    var orderIds = orders.stream().map(OrderRow::orderId).toList();
    var procurements = repository.findProcurements(orderIds);
    var workerLogs = repository.findWorkerTimeLogs(orderIds);

    Map<String, List<ProcurementRow>> procurementsByOrder =
        procurements.stream().collect(Collectors.groupingBy(ProcurementRow::orderId));
    Map<String, List<WorkerTimeLogRow>> workerLogsByOrder =
        workerLogs.stream().collect(Collectors.groupingBy(WorkerTimeLogRow::orderId));

    var kpis = new ArrayList<OrderKpi>(orders.size());
    for (OrderRow order : orders) {
      kpis.add(
          calculator.calculate(
              OrderInputNormalizer.normalize(order),
              procurementsByOrder.getOrDefault(order.orderId(), List.of()),
              workerLogsByOrder.getOrDefault(order.orderId(), List.of())));
    }
    log.debug(
        "Computed {} order KPI(s) from {} procurement(s) and {} worker log(s)",
        kpis.size(),
        procurements.size(),
        workerLogs.size());
    return new OrderKpiBatch(List.copyOf(kpis), procurements);
  }

  int effectivePageSize(Integer requested) {
    int size = requested != null ? requested : properties.defaultPageSize();
    return Math.max(1, Math.min(size, properties.maxPageSize()));
  }

  public static void validateDateRange(LocalDate from, LocalDate to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new InvalidStateException(
          "Invalid Date Range", "'from' date must not be after 'to' date");
    }
  }
}
