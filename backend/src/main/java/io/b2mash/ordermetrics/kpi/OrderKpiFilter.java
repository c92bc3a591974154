package io.b2mash.ordermetrics.kpi;

import java.time.LocalDate;

/**
 * Request-level filter for KPI listings. Every component is optional; {@code page} is 1-indexed and
 * {@code pageSize} is clamped by the service.
 */
public record OrderKpiFilter(
    LocalDate from, LocalDate to, String q, Integer page, Integer pageSize) {

  public static OrderKpiFilter unpaged(LocalDate from, LocalDate to, String q) {
    return new OrderKpiFilter(from, to, q, null, null);
  }
}
