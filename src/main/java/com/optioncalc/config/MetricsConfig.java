package com.optioncalc.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name so the calculator's meters and the
 * auto-configured JVM/HTTP meters share one dimension. The calculator's own meters
 * are defined in {@link com.optioncalc.observability.CalculatorMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:option-calculator}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
