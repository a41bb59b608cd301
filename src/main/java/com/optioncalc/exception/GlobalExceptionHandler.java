package com.optioncalc.exception;

import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.optioncalc.api.dto.response.ApiErrorResponse;
import com.optioncalc.api.dto.response.ApiErrorResponse.ErrorDetail;
import com.optioncalc.domain.enums.FailureKind;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.StringUtils;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Translates calculator failures into {@link ApiErrorResponse} bodies.
 *
 * <p>Engine rejections keep their reason verbatim as the message, so the client can
 * show it as-is. Request problems caught before the engine runs are reported per
 * field.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(CalculationException.class)
    public ResponseEntity<ApiErrorResponse> handleCalculation(CalculationException ex, HttpServletRequest request) {
        log.warn("Calculation rejected ({}): {}", ex.getKind(), ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getKind(), null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        log.debug("Request validation failed on {}: {}", request.getRequestURI(), fieldErrors);
        return respond(ErrorCode.VALIDATION_ERROR, "Validation failed", null, fieldErrors, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        // A bad date or enum value names its field; anything else is just malformed JSON
        if (ex.getCause() instanceof InvalidFormatException invalidFormat && !invalidFormat.getPath().isEmpty()) {
            String field = invalidFormat.getPath().get(invalidFormat.getPath().size() - 1).getFieldName();
            Map<String, String> fieldErrors = Map.of(field, "Invalid value '" + invalidFormat.getValue() + "'");
            return respond(ErrorCode.MALFORMED_REQUEST, "Malformed request body", null, fieldErrors, request);
        }
        return respond(ErrorCode.MALFORMED_REQUEST, "Malformed request body", null, null, request);
    }

    // NoResourceFoundException from Boot's static resource handler, NoHandlerFoundException without it
    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ApiErrorResponse> handleNotFound(Exception ex, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, "No endpoint at " + request.getRequestURI(), null, null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        ResponseEntity<ApiErrorResponse> response = respond(
                ErrorCode.METHOD_NOT_ALLOWED,
                ex.getMethod() + " is not supported on " + request.getRequestURI(),
                null,
                null,
                request);
        if (ex.getSupportedHttpMethods() == null || ex.getSupportedHttpMethods().isEmpty()) {
            return response;
        }
        return ResponseEntity.status(response.getStatusCode())
                .header(HttpHeaders.ALLOW, StringUtils.collectionToCommaDelimitedString(ex.getSupportedHttpMethods()))
                .body(response.getBody());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        String message = ex.getContentType() != null
                ? "Content type " + ex.getContentType() + " is not supported, use application/json"
                : "Content type is required, use application/json";
        return respond(ErrorCode.UNSUPPORTED_MEDIA_TYPE, message, null, null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, null, request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode code,
            String message,
            FailureKind kind,
            Map<String, String> fieldErrors,
            HttpServletRequest request) {
        ErrorDetail error = ErrorDetail.builder()
                .code(code)
                .message(message)
                .kind(kind)
                .fieldErrors(fieldErrors)
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(code.getHttpStatus()).body(ApiErrorResponse.of(error));
    }
}
