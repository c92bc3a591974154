package io.b2mash.ordermetrics.source;

import java.time.LocalDate;

/**
 * Filter for order reads. {@code from}/{@code to} are inclusive due-date bounds, {@code q} is a
 * case-insensitive substring of the product name. {@code limit} is null for unpaged reads.
 */
public record OrderQuery(LocalDate from, LocalDate to, String q, Integer limit, long offset) {

  public static OrderQuery dueBetween(LocalDate from, LocalDate to) {
    return new OrderQuery(from, to, null, null, 0);
  }

  public static OrderQuery matching(LocalDate from, LocalDate to, String q) {
    return new OrderQuery(from, to, q == null || q.isBlank() ? null : q.trim(), null, 0);
  }

  public OrderQuery page(int limit, long offset) {
    return new OrderQuery(from, to, q, limit, offset);
  }

  public boolean isPaged() {
    return limit != null;
  }
}
