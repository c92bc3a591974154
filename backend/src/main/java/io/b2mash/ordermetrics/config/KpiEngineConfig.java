package io.b2mash.ordermetrics.config;

import io.b2mash.ordermetrics.kpi.OrderKpiCalculator;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KpiEngineConfig {

  @Bean
  public OrderKpiCalculator orderKpiCalculator(OrderMetricsProperties properties) {
    return new OrderKpiCalculator(properties.defaultWageRate());
  }

  /** "Now" for overdue checks. Replaced by a fixed clock in tests. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
