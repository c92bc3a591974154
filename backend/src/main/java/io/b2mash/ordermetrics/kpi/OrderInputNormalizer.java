package io.b2mash.ordermetrics.kpi;

import io.b2mash.ordermetrics.source.OrderRow;

/**
 * The single place where absent order values are defaulted. Both the single-order and the batch
 * paths run through here so that they agree on every field.
 *
 * <p>Substitutions:
 *
 * <ul>
 *   <li>qty, sales, estimated material cost, standard time per unit -> 0
 *   <li>product name -> ""
 *   <li>due date -> {@link #NO_DUE_DATE}
 *   <li>status -> {@link #DEFAULT_STATUS}
 *   <li>customer name -> left null
 * </ul>
 */
public final class OrderInputNormalizer {

  public static final String NO_DUE_DATE = "";
  public static final String DEFAULT_STATUS = "pending";

  private OrderInputNormalizer() {}

  public static NormalizedOrder normalize(OrderRow row) {
    return new NormalizedOrder(
        row.orderId(),
        row.productName() != null ? row.productName() : "",
        orZero(row.qty()),
        row.dueDate() != null ? row.dueDate() : NO_DUE_DATE,
        orZero(row.sales()),
        orZero(row.estimatedMaterialCost()),
        orZero(row.stdTimePerUnit()),
        row.status() != null ? row.status() : DEFAULT_STATUS,
        row.customerName());
  }

  /** Absent procurement and time-log numerics count as zero, as an SQL SUM would treat them. */
  public static double orZero(Double value) {
    return value != null ? value : 0.0;
  }
}
