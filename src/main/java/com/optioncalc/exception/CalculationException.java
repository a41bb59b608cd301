package com.optioncalc.exception;

import com.optioncalc.domain.enums.FailureKind;
import com.optioncalc.domain.model.CalculationFailure;
import lombok.Getter;

/**
 * Raised at the HTTP edge when the engine reports a {@link CalculationFailure}.
 * The engine itself never throws; it returns failures as values.
 */
@Getter
public class CalculationException extends RuntimeException {

    private final transient CalculationFailure failure;
    private final ErrorCode errorCode;

    public CalculationException(CalculationFailure failure) {
        super(failure.getReason());
        this.failure = failure;
        this.errorCode = ErrorCode.forFailure(failure.getKind());
    }

    public FailureKind getKind() {
        return failure.getKind();
    }
}
