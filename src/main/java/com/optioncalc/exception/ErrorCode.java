package com.optioncalc.exception;

import com.optioncalc.domain.enums.FailureKind;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes rendered in {@code error.code} of a failed API response, with the HTTP
 * status each one maps to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(400),
    MALFORMED_REQUEST(400),
    NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    UNSUPPORTED_MEDIA_TYPE(415),
    IV_NOT_CONVERGED(422),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    public static ErrorCode forFailure(FailureKind kind) {
        return kind == FailureKind.NON_CONVERGENCE ? IV_NOT_CONVERGED : VALIDATION_ERROR;
    }
}
