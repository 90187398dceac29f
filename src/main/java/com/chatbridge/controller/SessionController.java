package com.chatbridge.controller;

import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.SessionNotFoundException;
import com.chatbridge.exception.UnsupportedModelException;
import com.chatbridge.session.Session;
import com.chatbridge.session.SessionStats;
import com.chatbridge.session.SessionStore;
import com.chatbridge.session.SessionSummary;
import com.chatbridge.translate.ModelRegistry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Tag(name = "Sessions")
@RestController
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionStore sessionStore;
    private final ModelRegistry modelRegistry;
    private final BridgeProperties properties;

    @Operation(summary = "List active sessions")
    @GetMapping
    public Mono<Map<String, Object>> list() {
        return Mono.fromSupplier(() -> {
            List<SessionSummary> sessions = sessionStore.list();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("sessions", sessions);
            body.put("total", sessions.size());
            log.debug("Listing {} session(s)", sessions.size());
            return body;
        });
    }

    @Operation(summary = "Create a session", description = "The id is generated when none is given.")
    @PostMapping
    public Mono<SessionSummary> create(@RequestBody(required = false) CreateSessionRequest request) {
        return Mono.fromSupplier(() -> {
            CreateSessionRequest body = request != null ? request : new CreateSessionRequest();
            String model = StringUtils.hasText(body.getModel()) ? body.getModel() : properties.getBackend().getDefaultModel();
            if (!modelRegistry.isSupported(model)) {
                throw new UnsupportedModelException(model, modelRegistry.supportedModels());
            }
            Session session = sessionStore.create(body.getSessionId(), model, body.getSystemPrompt());
            return session.summary();
        });
    }

    @Operation(summary = "Aggregate session statistics")
    @GetMapping("/stats")
    public Mono<Map<String, Object>> stats() {
        return Mono.fromSupplier(() -> {
            SessionStats stats = sessionStore.stats();
            Map<String, Object> sessionStats = new LinkedHashMap<>();
            sessionStats.put("active_sessions", stats.getActive());
            sessionStats.put("expired_sessions", stats.getExpired());
            sessionStats.put("total_messages", stats.getTotalMessages());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("session_stats", sessionStats);
            body.put("cleanup_interval_minutes", properties.getSession().getCleanupIntervalMs() / 60_000.0);
            body.put("default_ttl_hours", properties.getSession().getTtlMinutes() / 60.0);
            return body;
        });
    }

    @Operation(summary = "Get one session")
    @GetMapping("/{sessionId}")
    public Mono<SessionSummary> get(@PathVariable String sessionId) {
        return Mono.fromSupplier(() -> sessionStore.get(sessionId)
                .map(Session::summary)
                .orElseThrow(() -> new SessionNotFoundException(sessionId)));
    }

    @Operation(summary = "Delete one session")
    @DeleteMapping("/{sessionId}")
    public Mono<Map<String, Object>> delete(@PathVariable String sessionId) {
        return Mono.fromSupplier(() -> {
            if (!sessionStore.delete(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            log.info("Session deleted via API sessionId={}", sessionId);
            return Map.<String, Object>of("message", "Session " + sessionId + " deleted successfully");
        });
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @Data
    public static class CreateSessionRequest {
        private String sessionId;
        private String model;
        private String systemPrompt;
    }
}
