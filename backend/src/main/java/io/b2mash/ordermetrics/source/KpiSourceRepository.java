package io.b2mash.ordermetrics.source;

import io.b2mash.ordermetrics.exception.DataAccessFailureException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Read-only access to the three relations the KPI engine consumes: {@code orders}, {@code
 * procurements} and {@code worker_time_logs}. Rows come back with nulls intact. Store failures are
 * rethrown as {@link DataAccessFailureException} naming the operation and its arguments.
 */
@Repository
public class KpiSourceRepository {

  private static final Logger log = LoggerFactory.getLogger(KpiSourceRepository.class);

  /** Upper bound on bind variables per IN list. */
  static final int IN_CLAUSE_CHUNK = 1_000;

  private static final String ORDER_COLUMNS =
      """
      SELECT order_id, product_name, qty, due_date, sales, estimated_material_cost,
             std_time_per_unit, status, customer_name
      FROM orders
      """;

  private static final String PROCUREMENT_COLUMNS =
      """
      SELECT id, order_id, kind, item_name, qty, unit_price, act_time_per_unit, status,
             eta, received_at, completed_at
      FROM procurements
      """;

  private static final String WORKER_LOG_COLUMNS =
      """
      SELECT id, order_id, qty, act_time_per_unit, worker, work_date
      FROM worker_time_logs
      """;

  private final JdbcClient jdbc;

  public KpiSourceRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  // --- Orders ---

  public Optional<OrderRow> findOrder(String orderId) {
    return read(
        "findOrder",
        "orderId=" + orderId,
        () ->
            jdbc.sql(ORDER_COLUMNS + "WHERE order_id = :orderId")
                .param("orderId", orderId)
                .query(KpiSourceRepository::mapOrder)
                .optional());
  }

  /**
   * Orders matching the query, due date ascending. Orders without a due date sort last and ties
   * fall back to the order id so that pages are stable.
   */
  public List<OrderRow> findOrders(OrderQuery query) {
    var params = new LinkedHashMap<String, Object>();
    var sql = new StringBuilder(ORDER_COLUMNS).append(whereClause(query, params));
    sql.append("ORDER BY due_date ASC NULLS LAST, order_id ASC\n");
    if (query.isPaged()) {
      sql.append("LIMIT :limit OFFSET :offset\n");
      params.put("limit", query.limit());
      params.put("offset", query.offset());
    }

    List<OrderRow> orders =
        read(
            "findOrders",
            String.valueOf(query),
            () ->
                jdbc.sql(sql.toString())
                    .params(params)
                    .query(KpiSourceRepository::mapOrder)
                    .list());
    log.debug("Loaded {} order(s) for {}", orders.size(), query);
    return orders;
  }

  /** Number of orders matching the query's filter, ignoring its paging. */
  public long countOrders(OrderQuery query) {
    var params = new LinkedHashMap<String, Object>();
    String sql = "SELECT COUNT(*) FROM orders\n" + whereClause(query, params);
    return read(
        "countOrders",
        String.valueOf(query),
        () -> jdbc.sql(sql).params(params).query(Long.class).single());
  }

  // --- Procurements ---

  public List<ProcurementRow> findProcurements(String orderId) {
    return read(
        "findProcurements",
        "orderId=" + orderId,
        () ->
            jdbc.sql(PROCUREMENT_COLUMNS + "WHERE order_id = :orderId ORDER BY id")
                .param("orderId", orderId)
                .query(KpiSourceRepository::mapProcurement)
                .list());
  }

  public List<ProcurementRow> findProcurements(Collection<String> orderIds) {
    var rows = new ArrayList<ProcurementRow>();
    for (List<String> chunk : chunk(orderIds)) {
      rows.addAll(
          read(
              "findProcurements",
              "orderIds=" + chunk.size() + " id(s)",
              () ->
                  jdbc.sql(PROCUREMENT_COLUMNS + "WHERE order_id IN (:orderIds) ORDER BY id")
                      .param("orderIds", chunk)
                      .query(KpiSourceRepository::mapProcurement)
                      .list()));
    }
    return rows;
  }

  // --- Worker time logs ---

  public List<WorkerTimeLogRow> findWorkerTimeLogs(String orderId) {
    return read(
        "findWorkerTimeLogs",
        "orderId=" + orderId,
        () ->
            jdbc.sql(WORKER_LOG_COLUMNS + "WHERE order_id = :orderId ORDER BY id")
                .param("orderId", orderId)
                .query(KpiSourceRepository::mapWorkerLog)
                .list());
  }

  public List<WorkerTimeLogRow> findWorkerTimeLogs(Collection<String> orderIds) {
    var rows = new ArrayList<WorkerTimeLogRow>();
    for (List<String> chunk : chunk(orderIds)) {
      rows.addAll(
          read(
              "findWorkerTimeLogs",
              "orderIds=" + chunk.size() + " id(s)",
              () ->
                  jdbc.sql(WORKER_LOG_COLUMNS + "WHERE order_id IN (:orderIds) ORDER BY id")
                      .param("orderIds", chunk)
                      .query(KpiSourceRepository::mapWorkerLog)
                      .list()));
    }
    return rows;
  }

  // --- Helpers ---

  private static String whereClause(OrderQuery query, Map<String, Object> params) {
    var conditions = new ArrayList<String>();
    if (query.from() != null) {
      conditions.add("due_date >= :from");
      params.put("from", query.from().toString());
    }
    if (query.to() != null) {
      conditions.add("due_date <= :to");
      params.put("to", query.to().toString());
    }
    if (query.q() != null) {
      conditions.add("LOWER(product_name) LIKE LOWER(:q) ESCAPE '\\'");
      params.put("q", "%" + escapeLike(query.q()) + "%");
    }
    return conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + "\n";
  }

  static String escapeLike(String text) {
    return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static List<List<String>> chunk(Collection<String> ids) {
    var distinct = List.copyOf(new LinkedHashSet<>(ids));
    var chunks = new ArrayList<List<String>>();
    for (int i = 0; i < distinct.size(); i += IN_CLAUSE_CHUNK) {
      chunks.add(distinct.subList(i, Math.min(i + IN_CLAUSE_CHUNK, distinct.size())));
    }
    return chunks;
  }

  private static <T> T read(String operation, String context, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException ex) {
      throw new DataAccessFailureException(operation, context, ex);
    }
  }

  private static OrderRow mapOrder(ResultSet rs, int rowNum) throws SQLException {
    return new OrderRow(
        rs.getString("order_id"),
        rs.getString("product_name"),
        nullableDouble(rs, "qty"),
        rs.getString("due_date"),
        nullableDouble(rs, "sales"),
        nullableDouble(rs, "estimated_material_cost"),
        nullableDouble(rs, "std_time_per_unit"),
        rs.getString("status"),
        rs.getString("customer_name"));
  }

  private static ProcurementRow mapProcurement(ResultSet rs, int rowNum) throws SQLException {
    return new ProcurementRow(
        rs.getLong("id"),
        rs.getString("order_id"),
        rs.getString("kind"),
        rs.getString("item_name"),
        nullableDouble(rs, "qty"),
        nullableDouble(rs, "unit_price"),
        nullableDouble(rs, "act_time_per_unit"),
        rs.getString("status"),
        rs.getString("eta"),
        rs.getString("received_at"),
        rs.getString("completed_at"));
  }

  private static WorkerTimeLogRow mapWorkerLog(ResultSet rs, int rowNum) throws SQLException {
    return new WorkerTimeLogRow(
        rs.getLong("id"),
        rs.getString("order_id"),
        nullableDouble(rs, "qty"),
        nullableDouble(rs, "act_time_per_unit"),
        rs.getString("worker"),
        rs.getString("work_date"));
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
