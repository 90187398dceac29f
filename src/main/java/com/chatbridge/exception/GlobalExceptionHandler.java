package com.chatbridge.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Request validation failed: {} details={}", ex.getMessage(), ex.getDetails());
        Map<String, Object> body = envelope(ex);
        body.put("details", ex.getDetails());
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler(UnsupportedModelException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedModel(UnsupportedModelException ex) {
        log.warn("Unsupported model requested model={}", ex.getModel());
        Map<String, Object> body = envelope(ex);
        body.put("supported_models", ex.getSupportedModels());
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleAuthentication(AuthenticationException ex) {
        log.error("Backend authentication unavailable method={} errors={}", ex.getMethod(), ex.getErrors());
        Map<String, Object> body = envelope(ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", ex.getMethod().wireName());
        details.put("errors", ex.getErrors());
        body.put("details", details);
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotFound(SessionNotFoundException ex) {
        log.debug("Session not found sessionId={}", ex.getSessionId());
        Map<String, Object> body = envelope(ex);
        body.put("detail", ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler(BackendInvocationException.class)
    public ResponseEntity<Map<String, Object>> handleBackend(BackendInvocationException ex) {
        log.error("Backend invocation failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(ex.getStatus())
                .body(envelope("Internal server error", ex.getType(), ex.getCode()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(ServerWebInputException ex) {
        log.warn("Unreadable request body: {}", ex.getReason());
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request body";
        return ResponseEntity.badRequest()
                .body(envelope(message, "invalid_request_error", "validation_error"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String type = status.is4xxClientError() ? "invalid_request_error" : "server_error";
        String message = ex.getReason() != null ? ex.getReason() : "Request failed";
        return ResponseEntity.status(status).body(envelope(message, type, String.valueOf(status.value())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(envelope("Internal server error", "server_error", "internal_error"));
    }

    private Map<String, Object> envelope(BridgeException ex) {
        return envelope(ex.getMessage(), ex.getType(), ex.getCode());
    }

    private Map<String, Object> envelope(String message, String type, String code) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("type", type);
        error.put("code", code);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        return body;
    }
}
