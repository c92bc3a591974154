package io.b2mash.ordermetrics.source;

/**
 * One {@code orders} row exactly as stored. Every attribute except the id may be null; nulls are
 * resolved later by {@code OrderInputNormalizer}, never here.
 *
 * @param dueDate due date text, normally {@code yyyy-MM-dd}
 * @param estimatedMaterialCost per-unit material cost estimate
 * @param stdTimePerUnit standard labor hours per unit, 0 or null when no standard is set
 */
public record OrderRow(
    String orderId,
    String productName,
    Double qty,
    String dueDate,
    Double sales,
    Double estimatedMaterialCost,
    Double stdTimePerUnit,
    String status,
    String customerName) {}
