package io.b2mash.ordermetrics.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.ordermetrics.kpi.NormalizedOrder;
import io.b2mash.ordermetrics.source.ProcurementRow;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CalendarEventProjectorTest {

  private SimpleMeterRegistry meterRegistry;
  private CalendarEventProjector projector;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    var clock = Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneOffset.UTC);
    projector = new CalendarEventProjector(meterRegistry, clock);
  }

  @Test
  void dueDateBeforeNowIsOverdueOtherwisePending() {
    var events =
        projector.project(
            List.of(order("O1", "Gear", "2025-03-01"), order("O2", "Bracket", "2025-03-10")),
            List.of());

    assertThat(events)
        .extracting(CalendarEvent::id, CalendarEvent::title, CalendarEvent::status)
        .containsExactly(
            tuple("order-O1", "Due: Gear", "overdue"),
            tuple("order-O2", "Due: Bracket", "pending"));
    assertThat(events).allSatisfy(e -> assertThat(e.procurementId()).isNull());
    assertThat(events).extracting(CalendarEvent::type).containsOnly("due_date");
  }

  @Test
  void ordersWithoutDueDateProduceNoEvent() {
    var events = projector.project(List.of(order("O3", "", "")), List.of());

    assertThat(events).isEmpty();
    assertThat(skipped("due_date")).isZero();
  }

  @Test
  void purchaseLifecycleEvents() {
    var purchase =
        new ProcurementRow(
            7,
            "O1",
            "purchase",
            "Steel",
            1.0,
            10.0,
            null,
            "received",
            "2025-02-20",
            "2025-02-21T09:30:00Z",
            null);

    var events = projector.project(List.of(), List.of(purchase));

    assertThat(events)
        .extracting(CalendarEvent::id, CalendarEvent::title, CalendarEvent::type)
        .containsExactly(
            tuple("proc-eta-7", "Arrival: Steel", "eta"),
            tuple("proc-received-7", "Received: Steel", "received"));
    assertThat(events).extracting(CalendarEvent::status).containsOnly("completed");
    assertThat(events).extracting(CalendarEvent::procurementId).containsOnly(7L);
    assertThat(events).extracting(CalendarEvent::orderId).containsOnly("O1");
  }

  @Test
  void manufactureEtaIsProductionAndPendingUntilDone() {
    var step =
        new ProcurementRow(
            8,
            "O1",
            "manufacture",
            "Machining",
            1.0,
            null,
            1.0,
            "in-progress",
            "2025-02-25",
            null,
            "2025-02-26 15:00:00");

    var events = projector.project(List.of(), List.of(step));

    assertThat(events).hasSize(2);
    assertThat(events.get(0).title()).isEqualTo("Production: Machining");
    assertThat(events.get(0).status()).isEqualTo("pending");
    assertThat(events.get(1).id()).isEqualTo("proc-completed-8");
    assertThat(events.get(1).title()).isEqualTo("Manufactured: Machining");
    assertThat(events.get(1).date()).isEqualTo("2025-02-26 15:00:00");
  }

  @Test
  void malformedDateSkipsOnlyThatEventAndIsCounted() {
    var step =
        new ProcurementRow(
            4, "O2", "manufacture", "Bending", 5.0, null, 2.0, "done", "not-a-date", null,
            "2025-03-02");

    var events = projector.project(List.of(order("O2", "Bracket", "2025-13-45")), List.of(step));

    assertThat(events).extracting(CalendarEvent::id).containsExactly("proc-completed-4");
    assertThat(skipped("eta")).isEqualTo(1.0);
    assertThat(skipped("due_date")).isEqualTo(1.0);
  }

  @Test
  void eventsAreSortedByDateAndStableForTies() {
    var orders = List.of(order("O5", "Flange", "2025-02-20"), order("O1", "Gear", "2025-03-01"));
    var procurements =
        List.of(
            new ProcurementRow(
                1, "O1", "purchase", "Plate", 1.0, 1.0, null, "received", "2025-02-20",
                "2025-02-21T09:30:00Z", null),
            new ProcurementRow(
                3, "O1", "purchase", "Bolts", 1.0, 1.0, null, "planned", "2025-02-28", null,
                null));

    var events = projector.project(orders, procurements);

    assertThat(events)
        .extracting(CalendarEvent::id)
        .containsExactly("order-O5", "proc-eta-1", "proc-received-1", "proc-eta-3", "order-O1");
  }

  @Test
  void eachCallStartsFromScratch() {
    var orders = List.of(order("O1", "Gear", "2025-03-01"));

    assertThat(projector.project(orders, List.of())).hasSize(1);
    assertThat(projector.project(orders, List.of())).hasSize(1);
  }

  @Test
  void parseStoredDateAcceptsDateDateTimeAndOffsetForms() {
    assertThat(CalendarEventProjector.parseStoredDate("2025-03-01"))
        .isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0));
    assertThat(CalendarEventProjector.parseStoredDate("2025-03-01T08:15:30"))
        .isEqualTo(LocalDateTime.of(2025, 3, 1, 8, 15, 30));
    assertThat(CalendarEventProjector.parseStoredDate("2025-03-01 08:15"))
        .isEqualTo(LocalDateTime.of(2025, 3, 1, 8, 15));
    assertThat(CalendarEventProjector.parseStoredDate("2025-03-01T09:00:00+09:00"))
        .isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0));
    assertThat(CalendarEventProjector.parseStoredDate("2025-03-01T09:00:00.000Z"))
        .isEqualTo(LocalDateTime.of(2025, 3, 1, 9, 0));
  }

  @Test
  void parseStoredDateRejectsMalformedValues() {
    assertThatThrownBy(() -> CalendarEventProjector.parseStoredDate("2025-02-30"))
        .isInstanceOf(DateTimeParseException.class);
    assertThatThrownBy(() -> CalendarEventProjector.parseStoredDate("03/01/2025"))
        .isInstanceOf(DateTimeParseException.class);
  }

  private double skipped(String source) {
    var counter =
        meterRegistry
            .find(CalendarEventProjector.SKIPPED_ROWS_METRIC)
            .tag("source", source)
            .counter();
    return counter != null ? counter.count() : 0;
  }

  private static NormalizedOrder order(String id, String productName, String dueDate) {
    return new NormalizedOrder(id, productName, 1, dueDate, 0, 0, 0, "pending", null);
  }
}
