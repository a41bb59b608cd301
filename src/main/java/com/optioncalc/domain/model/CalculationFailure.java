package com.optioncalc.domain.model;

import com.optioncalc.domain.enums.FailureKind;
import lombok.Value;

/**
 * Typed reason a calculation produced no result. The reason text is meant to be
 * shown to the trader verbatim.
 */
@Value
public class CalculationFailure {

    FailureKind kind;
    String reason;

    public static CalculationFailure invalidInput(String reason) {
        return new CalculationFailure(FailureKind.INVALID_INPUT, reason);
    }

    public static CalculationFailure nonConvergence(String reason) {
        return new CalculationFailure(FailureKind.NON_CONVERGENCE, reason);
    }
}
