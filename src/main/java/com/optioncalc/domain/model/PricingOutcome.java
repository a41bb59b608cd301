package com.optioncalc.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of pricing from a known volatility. Either carries a complete
 * {@link PricingResult} or a {@link CalculationFailure}, never both.
 */
@Data
@Builder
public class PricingOutcome {

    private boolean success;
    private PricingResult result;
    private CalculationFailure failure;

    public static PricingOutcome success(PricingResult result) {
        return PricingOutcome.builder().success(true).result(result).build();
    }

    public static PricingOutcome failed(CalculationFailure failure) {
        return PricingOutcome.builder().success(false).failure(failure).build();
    }
}
