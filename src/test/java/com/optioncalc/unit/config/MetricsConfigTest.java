package com.optioncalc.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.optioncalc.config.MetricsConfig;
import com.optioncalc.observability.CalculatorMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MetricsConfigTest {

    @Test
    @DisplayName("Common application tag is applied to calculator meters")
    void applicationTagApplied() {
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        new MetricsConfig().commonTags("option-calculator").customize(meterRegistry);

        new CalculatorMetricsService(meterRegistry).recordPricing();

        assertThat(meterRegistry
                        .get("option.pricing.count")
                        .tag("application", "option-calculator")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }
}
