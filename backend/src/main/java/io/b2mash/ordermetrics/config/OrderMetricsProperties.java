package io.b2mash.ordermetrics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Process-wide settings for the KPI engine.
 *
 * @param defaultWageRate hourly labor rate applied to every order's actual hours
 * @param defaultPageSize page size used when a list request does not specify one
 * @param maxPageSize upper bound applied to any requested page size
 */
@ConfigurationProperties(prefix = "order-metrics")
public record OrderMetricsProperties(
    @DefaultValue("2000") double defaultWageRate,
    @DefaultValue("20") int defaultPageSize,
    @DefaultValue("100") int maxPageSize) {}
