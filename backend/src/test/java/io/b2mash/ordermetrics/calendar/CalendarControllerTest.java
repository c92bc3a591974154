package io.b2mash.ordermetrics.calendar;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.ordermetrics.TestcontainersConfiguration;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class CalendarControllerTest {

  @TestConfiguration(proxyBeanMethods = false)
  static class FixedClockConfig {

    @Bean
    @Primary
    Clock fixedClock() {
      return Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneOffset.UTC);
    }
  }

  @Autowired private MockMvc mockMvc;

  @Test
  void eventsAreSortedAndMalformedDatesSkipped() throws Exception {
    mockMvc
        .perform(get("/api/calendar"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(10)))
        .andExpect(
            jsonPath(
                "$[*].id",
                contains(
                    "order-O5",
                    "proc-eta-1",
                    "proc-received-1",
                    "proc-eta-2",
                    "proc-completed-2",
                    "proc-eta-3",
                    "order-O1",
                    "order-O2",
                    "proc-eta-5",
                    "order-O4")));
  }

  @Test
  void dueDateStatusFollowsClock() throws Exception {
    mockMvc
        .perform(get("/api/calendar").param("from", "2025-03-01").param("to", "2025-03-31"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.id == 'order-O1')].status", contains("overdue")))
        .andExpect(jsonPath("$[?(@.id == 'order-O2')].status", contains("pending")))
        .andExpect(jsonPath("$[?(@.id == 'order-O2')].title", contains("Due: Bracket")))
        .andExpect(jsonPath("$[?(@.id == 'proc-eta-3')].title", contains("Arrival: Bolts")))
        .andExpect(jsonPath("$[?(@.id == 'proc-eta-2')].title", contains("Production: Machining")))
        .andExpect(jsonPath("$[?(@.id == 'proc-eta-5')]", hasSize(0)));
  }

  @Test
  void invertedRangeReturns400() throws Exception {
    mockMvc
        .perform(get("/api/calendar").param("from", "2025-04-01").param("to", "2025-03-01"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid Date Range"));
  }
}
