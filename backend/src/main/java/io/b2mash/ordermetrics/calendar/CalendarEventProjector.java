package io.b2mash.ordermetrics.calendar;

import io.b2mash.ordermetrics.kpi.NormalizedOrder;
import io.b2mash.ordermetrics.source.ProcurementKind;
import io.b2mash.ordermetrics.source.ProcurementRow;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns orders and their procurements into a date-sorted list of calendar events.
 *
 * <p>Events are collected orders first, then per procurement its eta, received and completed
 * events, and sorted stably by date, so events on the same instant keep that order. A stored date
 * that cannot be parsed drops only the event it would have produced; the skip is logged and counted
 * on {@value #SKIPPED_ROWS_METRIC}.
 */
@Component
public class CalendarEventProjector {

  private static final Logger log = LoggerFactory.getLogger(CalendarEventProjector.class);

  static final String SKIPPED_ROWS_METRIC = "order_metrics.calendar.skipped_rows";

  // yyyy-MM-dd, optionally followed by THH:mm[:ss[.fff]] and an optional offset or Z
  private static final DateTimeFormatter STORED_DATE =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .optionalStart()
          .appendLiteral('T')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .optionalStart()
          .appendOffsetId()
          .optionalEnd()
          .optionalEnd()
          .toFormatter()
          .withResolverStyle(ResolverStyle.STRICT);

  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public CalendarEventProjector(MeterRegistry meterRegistry, Clock clock) {
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public List<CalendarEvent> project(
      List<NormalizedOrder> orders, List<ProcurementRow> procurements) {
    var now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
    var dated = new ArrayList<DatedEvent>();

    for (NormalizedOrder order : orders) {
      if (!order.hasDueDate()) {
        continue;
      }
      var due = parse(order.dueDate(), "due_date", "order-" + order.orderId());
      if (due == null) {
        continue;
      }
      dated.add(
          new DatedEvent(
              due,
              new CalendarEvent(
                  "order-" + order.orderId(),
                  "Due: " + order.productName(),
                  order.dueDate(),
                  CalendarEvent.TYPE_DUE_DATE,
                  due.isBefore(now) ? CalendarEvent.STATUS_OVERDUE : CalendarEvent.STATUS_PENDING,
                  order.orderId(),
                  null)));
    }

    for (ProcurementRow procurement : procurements) {
      addProcurementEvent(
          dated,
          procurement,
          procurement.eta(),
          "proc-eta-",
          etaTitle(procurement),
          CalendarEvent.TYPE_ETA,
          procurement.isCompleted()
              ? CalendarEvent.STATUS_COMPLETED
              : CalendarEvent.STATUS_PENDING);
      addProcurementEvent(
          dated,
          procurement,
          procurement.receivedAt(),
          "proc-received-",
          "Received: " + itemName(procurement),
          CalendarEvent.TYPE_RECEIVED,
          CalendarEvent.STATUS_COMPLETED);
      addProcurementEvent(
          dated,
          procurement,
          procurement.completedAt(),
          "proc-completed-",
          "Manufactured: " + itemName(procurement),
          CalendarEvent.TYPE_COMPLETED,
          CalendarEvent.STATUS_COMPLETED);
    }

    dated.sort(Comparator.comparing(DatedEvent::at));
    return dated.stream().map(DatedEvent::event).toList();
  }

  private void addProcurementEvent(
      List<DatedEvent> dated,
      ProcurementRow procurement,
      String rawDate,
      String idPrefix,
      String title,
      String type,
      String status) {
    if (rawDate == null || rawDate.isEmpty()) {
      return;
    }
    String id = idPrefix + procurement.id();
    var at = parse(rawDate, type, id);
    if (at != null) {
      dated.add(
          new DatedEvent(
              at,
              new CalendarEvent(
                  id, title, rawDate, type, status, procurement.orderId(), procurement.id())));
    }
  }

  private static String etaTitle(ProcurementRow procurement) {
    return (procurement.isKind(ProcurementKind.MANUFACTURE) ? "Production: " : "Arrival: ")
        + itemName(procurement);
  }

  private static String itemName(ProcurementRow procurement) {
    return procurement.itemName() != null ? procurement.itemName() : "";
  }

  /** Returns the UTC local date-time of a stored date, or null after recording a skip. */
  private LocalDateTime parse(String raw, String source, String eventId) {
    try {
      return parseStoredDate(raw);
    } catch (DateTimeParseException ex) {
      log.warn("Skipping calendar event {}: unparseable {} value '{}'", eventId, source, raw);
      meterRegistry.counter(SKIPPED_ROWS_METRIC, "source", source).increment();
      return null;
    }
  }

  static LocalDateTime parseStoredDate(String raw) {
    String text = raw.trim();
    if (text.length() > 10 && text.charAt(10) == ' ') {
      text = text.substring(0, 10) + 'T' + text.substring(11);
    }
    TemporalAccessor parsed =
        STORED_DATE.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
    if (parsed instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    if (parsed instanceof LocalDateTime localDateTime) {
      return localDateTime;
    }
    return ((LocalDate) parsed).atStartOfDay();
  }

  private record DatedEvent(LocalDateTime at, CalendarEvent event) {}
}
