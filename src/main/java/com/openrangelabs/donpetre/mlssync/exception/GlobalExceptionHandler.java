package com.openrangelabs.donpetre.mlssync.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the MLS sync service.
 *
 * <p>Maps domain exceptions to HTTP status codes and a structured
 * {@link ErrorResponse}. Provider credentials never appear in messages.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles unknown providers, runs, errors and duplicate candidates.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(
            ResourceNotFoundException ex, ServerWebExchange exchange) {

        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(buildResponse(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), null, exchange));
    }

    /**
     * Handles operations that are invalid for the current run state.
     */
    @ExceptionHandler(SyncStateException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSyncState(
            SyncStateException ex, ServerWebExchange exchange) {

        log.warn("Rejected sync operation: {}", ex.getMessage());
        return Mono.just(buildResponse(HttpStatus.CONFLICT, "Invalid Sync State", ex.getMessage(), null, exchange));
    }

    /**
     * Handles failures reported by an upstream provider during a request-scoped call.
     */
    @ExceptionHandler(MlsProviderException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleProviderException(
            MlsProviderException ex, ServerWebExchange exchange) {

        log.error("Provider call failed ({}): {}", ex.getType(), ex.getMessage());
        return Mono.just(buildResponse(HttpStatus.BAD_GATEWAY, "Provider Error", ex.getMessage(),
                ex.getType().name(), exchange));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {

        log.warn("Bad request: {}", ex.getMessage());
        return Mono.just(buildResponse(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), null, exchange));
    }

    /**
     * Handles validation exceptions.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles access denied exceptions.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {

        log.warn("Access denied: {}", ex.getMessage());
        return Mono.just(buildResponse(HttpStatus.FORBIDDEN, "Access Denied",
                "Insufficient privileges to access this resource", null, exchange));
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return Mono.just(buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", null, exchange));
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
                                                        String details, ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
