package com.chatbridge.controller;

import com.chatbridge.auth.AuthResolver;
import com.chatbridge.auth.CliProbe;
import com.chatbridge.backend.BackendClient;
import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.GlobalExceptionHandler;
import com.chatbridge.parser.ResponseParser;
import com.chatbridge.service.impl.ChatCompletionServiceImpl;
import com.chatbridge.session.InMemorySessionStore;
import com.chatbridge.session.SessionStore;
import com.chatbridge.streaming.StreamingPipeline;
import com.chatbridge.tools.ToolCallBridge;
import com.chatbridge.translate.InvocationDescriptor;
import com.chatbridge.translate.ModelRegistry;
import com.chatbridge.translate.RequestTranslator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChatControllerTests {

    private final Map<String, String> env = new HashMap<>();
    private final List<InvocationDescriptor> invocations = new ArrayList<>();

    private ObjectMapper mapper;
    private SessionStore sessionStore;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        env.put("ANTHROPIC_API_KEY", "sk-ant-REDACTED");
        mapper = new ObjectMapper();
        BridgeProperties properties = new BridgeProperties();
        Clock clock = Clock.systemUTC();
        ToolCallBridge bridge = new ToolCallBridge(mapper);
        ResponseParser parser = new ResponseParser(mapper, bridge);
        sessionStore = new InMemorySessionStore(properties, clock);
        AuthResolver authResolver = new AuthResolver(() -> Map.copyOf(env),
                () -> CliProbe.ProbeResult.failed("Claude CLI not found at 'claude'"), clock);
        BackendClient backend = descriptor -> {
            invocations.add(descriptor);
            return Flux.fromIterable(scriptedOutput(descriptor));
        };
        ChatCompletionServiceImpl service = new ChatCompletionServiceImpl(authResolver,
                new RequestTranslator(new ModelRegistry(properties), sessionStore, bridge),
                backend, parser, new StreamingPipeline(parser, sessionStore, mapper, properties, clock),
                sessionStore, properties, clock);
        client = WebTestClient.bindToController(new ChatController(service, mapper))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static List<String> scriptedOutput(InvocationDescriptor descriptor) {
        List<String> lines = new ArrayList<>();
        lines.add("{\"type\":\"system\",\"subtype\":\"init\"}");
        if (descriptor.isStream()) {
            lines.add("{\"type\":\"stream_event\",\"event\":{\"type\":\"message_start\"}}");
            for (String piece : List.of("Hello", " from", " the backend")) {
                lines.add("{\"type\":\"stream_event\",\"event\":{\"type\":\"content_block_delta\","
                        + "\"delta\":{\"type\":\"text_delta\",\"text\":\"" + piece + "\"}}}");
            }
        }
        lines.add("{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Hello from the backend\"}]}}");
        lines.add("{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"Hello from the backend\"}");
        return lines;
    }

    private JsonNode postJson(String body) throws Exception {
        byte[] response = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();
        return mapper.readTree(response);
    }

    @Test
    void completionReturnsOpenAiShape() throws Exception {
        JsonNode body = postJson("""
                {"model": "claude-sonnet-4-20250514",
                 "messages": [{"role": "user", "content": "Hi"}]}
                """);

        assertThat(body.path("id").asText()).startsWith("chatcmpl-");
        assertThat(body.path("object").asText()).isEqualTo("chat.completion");
        assertThat(body.path("model").asText()).isEqualTo("claude-sonnet-4-20250514");
        JsonNode choice = body.path("choices").get(0);
        assertThat(choice.path("index").asInt()).isZero();
        assertThat(choice.path("message").path("role").asText()).isEqualTo("assistant");
        assertThat(choice.path("message").path("content").asText()).isEqualTo("Hello from the backend");
        assertThat(choice.path("finish_reason").asText()).isEqualTo("stop");
        JsonNode usage = body.path("usage");
        assertThat(usage.path("total_tokens").asInt())
                .isEqualTo(usage.path("prompt_tokens").asInt() + usage.path("completion_tokens").asInt());
        assertThat(body.has("session_id")).isFalse();
    }

    @Test
    void streamingReturnsEventStreamEndingWithDone() {
        byte[] raw = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"model": "claude-sonnet-4-20250514", "stream": true,
                         "messages": [{"role": "user", "content": "Hi"}]}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        String text = new String(raw, StandardCharsets.UTF_8);
        List<String> events = Arrays.stream(text.split("\n\n")).filter(event -> !event.isBlank()).toList();

        assertThat(events.size()).isGreaterThanOrEqualTo(3);
        assertThat(events).allSatisfy(event -> assertThat(event).startsWith("data: "));
        assertThat(events.get(events.size() - 1)).isEqualTo("data: [DONE]");
        assertThat(text).contains("\"finish_reason\":\"stop\"").contains("chat.completion.chunk");
        assertThat(text).contains("\"content\":\" the backend\"");
    }

    @Test
    void sessionCarriesHistoryAcrossRequests() throws Exception {
        postJson("""
                {"model": "claude-sonnet-4-20250514", "session_id": "abc",
                 "messages": [{"role": "user", "content": "My name is Ada."}]}
                """);
        JsonNode second = postJson("""
                {"model": "claude-sonnet-4-20250514", "session_id": "abc",
                 "messages": [{"role": "user", "content": "What is my name?"}]}
                """);

        assertThat(second.path("session_id").asText()).isEqualTo("abc");
        InvocationDescriptor last = invocations.get(invocations.size() - 1);
        assertThat(last.getPrompt()).contains("My name is Ada.").contains("Assistant: Hello from the backend")
                .endsWith("Human: What is my name?");
        assertThat(sessionStore.get("abc").orElseThrow().getMessageCount()).isEqualTo(4);
    }

    @Test
    void unsupportedModelIsA400WithSupportedList() throws Exception {
        byte[] raw = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"model": "gpt-4", "messages": [{"role": "user", "content": "Hi"}]}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        JsonNode body = mapper.readTree(raw);
        assertThat(body.path("error").path("type").asText()).isEqualTo("invalid_request_error");
        assertThat(body.path("error").path("code").asText()).isEqualTo("model_not_supported");
        assertThat(body.path("supported_models").size()).isPositive();
        assertThat(invocations).isEmpty();
    }

    @Test
    void invalidHeaderIsA400() {
        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Claude-Max-Turns", "many")
                .bodyValue("""
                        {"model": "claude-sonnet-4-20250514", "messages": [{"role": "user", "content": "Hi"}]}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("validation_error")
                .jsonPath("$.details[0].field").isEqualTo("X-Claude-Max-Turns");
    }

    @Test
    void missingCredentialsIsA503() {
        env.clear();

        client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"model": "claude-sonnet-4-20250514", "messages": [{"role": "user", "content": "Hi"}]}
                        """)
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("authentication_error")
                .jsonPath("$.details.method").isEqualTo("none");
        assertThat(invocations).isEmpty();
    }
}
