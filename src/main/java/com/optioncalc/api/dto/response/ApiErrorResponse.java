package com.optioncalc.api.dto.response;

import com.optioncalc.domain.enums.FailureKind;
import com.optioncalc.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Envelope for failed calculator responses: {@code {success: false, error: {...}}}.
 *
 * <p>{@code kind} is set when the engine rejected the calculation; {@code fieldErrors}
 * when request validation failed before the engine was called.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorDetail error) {
        return new ApiErrorResponse(error);
    }

    @Value
    @Builder
    public static class ErrorDetail {
        ErrorCode code;
        String message;
        FailureKind kind;
        Map<String, String> fieldErrors;
        Instant timestamp;
        String path;
    }
}
