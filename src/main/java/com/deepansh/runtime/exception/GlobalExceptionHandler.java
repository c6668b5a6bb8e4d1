package com.deepansh.runtime.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PromptTooLongException.class)
    public ResponseEntity<Map<String, Object>> handlePromptTooLong(PromptTooLongException ex) {
        log.warn("Rejected prompt: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "prompt_too_long", ex.getMessage());
    }

    @ExceptionHandler(AgentCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(AgentCancelledException ex) {
        return error(HttpStatus.CONFLICT, "cancelled", ex.getMessage());
    }

    @ExceptionHandler(AgentBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(AgentBusyException ex) {
        return error(HttpStatus.CONFLICT, "busy", ex.getMessage());
    }

    @ExceptionHandler(IterationLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleIterationLimit(IterationLimitExceededException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "iteration_limit_exceeded", ex.getMessage());
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitedException ex) {
        log.warn("Provider rate limit exhausted retries: {}", ex.getMessage());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getRetryAfter() != null) {
            builder.header("Retry-After", String.valueOf(ex.getRetryAfter().toSeconds()));
        }
        return builder.body(errorBody("rate_limited", ex.getMessage()));
    }

    @ExceptionHandler(LlmApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiError(LlmApiException ex) {
        log.error("Provider API error: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "api_error", ex.getMessage());
    }

    @ExceptionHandler(LlmTransportException.class)
    public ResponseEntity<Map<String, Object>> handleTransport(LlmTransportException ex) {
        log.error("Provider unreachable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "transport", ex.getMessage());
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<Map<String, Object>> handleAgentException(AgentException ex) {
        log.error("Agent error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "agent_error", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return error(HttpStatus.BAD_REQUEST, "validation", msg);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String kind, String message) {
        return ResponseEntity.status(status).body(errorBody(kind, message));
    }

    static Map<String, Object> errorBody(String kind, String message) {
        return Map.of(
                "error", message != null ? message : kind,
                "kind", kind,
                "timestamp", Instant.now().toString()
        );
    }
}
