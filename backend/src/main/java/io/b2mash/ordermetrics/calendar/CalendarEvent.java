package io.b2mash.ordermetrics.calendar;

/**
 * One entry of the order calendar. {@code date} is the stored value the event was built from;
 * {@code procurementId} is null for due-date events.
 */
public record CalendarEvent(
    String id,
    String title,
    String date,
    String type,
    String status,
    String orderId,
    Long procurementId) {

  public static final String TYPE_DUE_DATE = "due_date";
  public static final String TYPE_ETA = "eta";
  public static final String TYPE_RECEIVED = "received";
  public static final String TYPE_COMPLETED = "completed";

  public static final String STATUS_PENDING = "pending";
  public static final String STATUS_OVERDUE = "overdue";
  public static final String STATUS_COMPLETED = "completed";
}
