package com.chatbridge.controller;

import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.GlobalExceptionHandler;
import com.chatbridge.model.Message;
import com.chatbridge.session.InMemorySessionStore;
import com.chatbridge.session.SessionStore;
import com.chatbridge.translate.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionControllerTests {

    private SessionStore sessionStore;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        BridgeProperties properties = new BridgeProperties();
        sessionStore = new InMemorySessionStore(properties, Clock.systemUTC());
        client = WebTestClient.bindToController(
                        new SessionController(sessionStore, new ModelRegistry(properties), properties))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createdSessionCanBeFetchedAndListed() {
        client.post().uri("/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"session_id\": \"s-42\", \"system_prompt\": \"Be brief.\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.session_id").isEqualTo("s-42")
                .jsonPath("$.model").isEqualTo("claude-sonnet-4-20250514")
                .jsonPath("$.message_count").isEqualTo(0)
                .jsonPath("$.status").isEqualTo("active");

        sessionStore.appendMessages("s-42", List.of(Message.user("hi")));

        client.get().uri("/v1/sessions/s-42")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message_count").isEqualTo(1);
        client.get().uri("/v1/sessions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(1)
                .jsonPath("$.sessions[0].session_id").isEqualTo("s-42");
    }

    @Test
    void createWithUnsupportedModelIsRejected() {
        client.post().uri("/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\": \"gpt-4\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("model_not_supported");
        assertThat(sessionStore.list()).isEmpty();
    }

    @Test
    void deleteRemovesTheSession() {
        sessionStore.create("gone", "claude-sonnet-4-20250514", null);

        client.delete().uri("/v1/sessions/gone")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Session gone deleted successfully");
        assertThat(sessionStore.get("gone")).isEmpty();
    }

    @Test
    void deletingUnknownSessionIsA404() {
        client.delete().uri("/v1/sessions/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Session missing not found")
                .jsonPath("$.error.type").isEqualTo("not_found_error");
    }

    @Test
    void unknownSessionLookupIsA404() {
        client.get().uri("/v1/sessions/nope")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void statsReportCountsAndRetention() {
        sessionStore.create("a", "claude-sonnet-4-20250514", null);
        sessionStore.appendMessages("a", List.of(Message.user("1"), Message.assistant("2")));

        client.get().uri("/v1/sessions/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.session_stats.active_sessions").isEqualTo(1)
                .jsonPath("$.session_stats.expired_sessions").isEqualTo(0)
                .jsonPath("$.session_stats.total_messages").isEqualTo(2)
                .jsonPath("$.cleanup_interval_minutes").isEqualTo(5.0)
                .jsonPath("$.default_ttl_hours").isEqualTo(1.0);
    }
}
