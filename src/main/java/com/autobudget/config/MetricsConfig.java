package com.autobudget.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Tags every meter with the service name and the wall-clock zone the loop runs in. */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> autoBudgetCommonTags(
            @Value("${spring.application.name:autobudget-backend}") String applicationName,
            AutoBudgetConfig autoBudgetConfig) {
        return registry -> registry.config()
                .commonTags("service", applicationName, "zone", autoBudgetConfig.getZoneId());
    }
}
