package com.flagship.cash_session.session.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PosSessionException.class)
    public ResponseEntity<ApiError> handleSessionException(PosSessionException e) {
        HttpStatus status = statusOf(e.getKind());
        log.warn("Session operation rejected: {} ({})", e.getMessage(), e.getKind());

        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(e.getKind().name())
            .message(e.getMessage())
            .details(e instanceof JustificationRequiredException required
                ? Map.of("cash_delta", required.getCashDelta().toString())
                : null)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return badRequest("Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest("Malformed request body or non-numeric amount", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_ACTIVE, ALREADY_CLOSED, NOT_ACTIVE -> HttpStatus.CONFLICT;
            case JUSTIFICATION_REQUIRED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case SESSIONS_DISABLED -> HttpStatus.FORBIDDEN;
        };
    }

    private static ResponseEntity<ApiError> badRequest(String message, Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
            .code(ErrorKind.INVALID_INPUT.name())
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
