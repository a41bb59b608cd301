package com.optioncalc.observability;

import com.optioncalc.domain.enums.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the calculator:
 * <ul>
 *   <li><b>option.pricing.count</b> (counter): successful valuations in PRICE mode</li>
 *   <li><b>option.iv.solved</b> (counter): implied volatility solves that converged</li>
 *   <li><b>option.iv.failed</b> (counter, tag {@code kind}): rejected or non-converged solves</li>
 *   <li><b>option.iv.iterations</b> (summary): Newton iterations per converged solve</li>
 *   <li><b>option.curve.build</b> (timer): payoff curve generation time</li>
 * </ul>
 */
@Service
public class CalculatorMetricsService {

    private final Counter pricingCounter;
    private final Counter ivSolvedCounter;
    private final Map<FailureKind, Counter> ivFailedCounters = new EnumMap<>(FailureKind.class);
    private final DistributionSummary ivIterations;
    private final Timer curveTimer;

    public CalculatorMetricsService(MeterRegistry meterRegistry) {
        this.pricingCounter = Counter.builder("option.pricing.count")
                .description("Valuations computed from a known volatility")
                .register(meterRegistry);

        this.ivSolvedCounter = Counter.builder("option.iv.solved")
                .description("Implied volatility solves that converged")
                .register(meterRegistry);

        for (FailureKind kind : FailureKind.values()) {
            ivFailedCounters.put(
                    kind,
                    Counter.builder("option.iv.failed")
                            .description("Implied volatility solves that produced no result")
                            .tag("kind", kind.name())
                            .register(meterRegistry));
        }

        this.ivIterations = DistributionSummary.builder("option.iv.iterations")
                .description("Newton-Raphson iterations per converged solve")
                .register(meterRegistry);

        this.curveTimer = Timer.builder("option.curve.build")
                .description("Payoff/P&L curve generation time")
                .register(meterRegistry);
    }

    public void recordPricing() {
        pricingCounter.increment();
    }

    public void recordIvSolved(int iterations) {
        ivSolvedCounter.increment();
        ivIterations.record(iterations);
    }

    public void recordIvFailed(FailureKind kind) {
        ivFailedCounters.get(kind).increment();
    }

    public <T> T timeCurve(Supplier<T> curveBuilder) {
        return curveTimer.record(curveBuilder);
    }
}
