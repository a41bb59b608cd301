package com.optioncalc.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of solving implied volatility from a market price.
 *
 * <p>On success, {@code volatilityPercent} is the solved volatility in percent
 * (e.g. 24.73) and {@code pricingResult} is the full call/put valuation at that
 * volatility. On failure only {@code failure} is set.
 */
@Data
@Builder
public class ImpliedVolatilityResult {

    private boolean solved;
    private double volatilityPercent;
    private PricingResult pricingResult;

    /** Newton-Raphson iterations used (1-indexed). Zero when validation rejected the input. */
    private int iterations;

    private CalculationFailure failure;

    public static ImpliedVolatilityResult solved(double volatilityPercent, PricingResult pricingResult, int iterations) {
        return ImpliedVolatilityResult.builder()
                .solved(true)
                .volatilityPercent(volatilityPercent)
                .pricingResult(pricingResult)
                .iterations(iterations)
                .build();
    }

    public static ImpliedVolatilityResult failed(CalculationFailure failure) {
        return ImpliedVolatilityResult.builder().solved(false).failure(failure).build();
    }

    public static ImpliedVolatilityResult failed(CalculationFailure failure, int iterations) {
        return ImpliedVolatilityResult.builder()
                .solved(false)
                .failure(failure)
                .iterations(iterations)
                .build();
    }
}
