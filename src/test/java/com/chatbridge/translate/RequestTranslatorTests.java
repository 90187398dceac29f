package com.chatbridge.translate;

import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.UnsupportedModelException;
import com.chatbridge.exception.ValidationException;
import com.chatbridge.model.ChatCompletionRequest;
import com.chatbridge.model.ChatMessage;
import com.chatbridge.model.Message;
import com.chatbridge.model.Role;
import com.chatbridge.model.ToolCall;
import com.chatbridge.session.InMemorySessionStore;
import com.chatbridge.session.SessionStore;
import com.chatbridge.tools.ToolCallBridge;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestTranslatorTests {

    private static final String MODEL = "claude-sonnet-4-20250514";

    private ObjectMapper mapper;
    private SessionStore sessionStore;
    private RequestTranslator translator;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        BridgeProperties properties = new BridgeProperties();
        sessionStore = new InMemorySessionStore(properties, Clock.systemUTC());
        translator = new RequestTranslator(new ModelRegistry(properties), sessionStore, new ToolCallBridge(mapper));
    }

    private static ChatMessage message(String role, String content) {
        return ChatMessage.builder().role(role).content(content == null ? null : TextNode.valueOf(content)).build();
    }

    private static ChatCompletionRequest request(ChatMessage... messages) {
        return ChatCompletionRequest.builder().model(MODEL).messages(List.of(messages)).build();
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void statelessRequestRendersPrompt() {
        TranslatedRequest translated = translator.translate(
                request(message("system", "Be terse."), message("user", "Hi")), HeaderOptions.none());

        InvocationDescriptor descriptor = translated.getDescriptor();
        assertThat(translated.sessionIfAny()).isEmpty();
        assertThat(descriptor.getModel()).isEqualTo(MODEL);
        assertThat(descriptor.getSystemPrompt()).isEqualTo("Be terse.");
        assertThat(descriptor.getPrompt()).isEqualTo("Human: Hi");
        assertThat(descriptor.getSessionId()).isNull();
        assertThat(descriptor.getToolConfig().isEnabled()).isFalse();
        assertThat(descriptor.getMaxTurns()).isEqualTo(1);
        assertThat(descriptor.getPromptTokens()).isPositive();
    }

    @Test
    void unsupportedModelIsRejected() {
        ChatCompletionRequest request = request(message("user", "Hi"));
        request.setModel("gpt-4o");

        assertThatThrownBy(() -> translator.translate(request, HeaderOptions.none()))
                .isInstanceOfSatisfying(UnsupportedModelException.class,
                        ex -> assertThat(ex.getSupportedModels()).contains(MODEL));
    }

    @Test
    void emptyMessagesAreRejected() {
        assertThatThrownBy(() -> translator.translate(request(), HeaderOptions.none()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void everyInvalidMessageIsReported() {
        ChatCompletionRequest request = request(
                message("wizard", "hi"),
                message("user", null),
                ChatMessage.builder().role("tool").content(TextNode.valueOf("42")).build());

        assertThatThrownBy(() -> translator.translate(request, HeaderOptions.none()))
                .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getDetails())
                        .extracting(ValidationException.FieldError::getField)
                        .containsExactly("messages[0].role", "messages[1].content", "messages[2].tool_call_id"));
    }

    @Test
    void contentPartsAreFlattenedAndImagesReplaced() throws Exception {
        ChatMessage parts = ChatMessage.builder().role("user").content(json("""
                [{"type": "text", "text": "What is this?"},
                 {"type": "image_url", "image_url": {"url": "data:image/png;base64,AAAA"}}]
                """)).build();

        InvocationDescriptor descriptor = translator.translate(request(parts), HeaderOptions.none()).getDescriptor();

        assertThat(descriptor.getPrompt()).isEqualTo("Human: What is this?\n[Image: Content not supported]");
    }

    @Test
    void multipleChoicesAreRejectedAndSamplingParametersIgnored() {
        ChatCompletionRequest tooMany = request(message("user", "Hi"));
        tooMany.setN(3);
        ChatCompletionRequest sampled = request(message("user", "Hi"));
        sampled.setTemperature(0.7);
        sampled.setMaxTokens(100);

        assertThatThrownBy(() -> translator.translate(tooMany, HeaderOptions.none()))
                .isInstanceOf(ValidationException.class);
        assertThat(translator.translate(sampled, HeaderOptions.none()).getDescriptor().getWarnings())
                .anySatisfy(warning -> assertThat(warning).startsWith("temperature"))
                .anySatisfy(warning -> assertThat(warning).startsWith("max_tokens"));
    }

    @Test
    void outOfRangeTemperatureIsRejected() {
        ChatCompletionRequest request = request(message("user", "Hi"));
        request.setTemperature(3.5);

        assertThatThrownBy(() -> translator.translate(request, HeaderOptions.none()))
                .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getDetails())
                        .extracting(ValidationException.FieldError::getField)
                        .containsExactly("temperature"));
    }

    @Test
    void sessionHistoryIsMergedAndIncomingStored() {
        ChatCompletionRequest first = request(message("system", "You are a pirate."), message("user", "My name is Ada."));
        first.setSessionId("abc");
        translator.translate(first, HeaderOptions.none());
        sessionStore.appendMessages("abc", List.of(Message.assistant("Ahoy Ada!")));

        ChatCompletionRequest second = request(message("user", "What is my name?"));
        second.setSessionId("abc");
        TranslatedRequest translated = translator.translate(second, HeaderOptions.none());

        InvocationDescriptor descriptor = translated.getDescriptor();
        assertThat(descriptor.getSessionId()).isEqualTo("abc");
        assertThat(descriptor.getMessages()).extracting(Message::getRole)
                .containsExactly(Role.SYSTEM, Role.USER, Role.ASSISTANT, Role.USER);
        assertThat(descriptor.getIncomingMessages()).hasSize(1);
        assertThat(descriptor.getSystemPrompt()).isEqualTo("You are a pirate.");
        assertThat(descriptor.getPrompt())
                .isEqualTo("Human: My name is Ada.\n\nAssistant: Ahoy Ada!\n\nHuman: What is my name?");
        assertThat(sessionStore.get("abc").orElseThrow().getMessageCount()).isEqualTo(4);
    }

    @Test
    void rejectedRequestDoesNotTouchTheSession() {
        ChatCompletionRequest first = request(message("user", "Hello"));
        first.setSessionId("keep");
        translator.translate(first, HeaderOptions.none());

        ChatCompletionRequest bad = request(message("user", "Again"));
        bad.setSessionId("keep");
        bad.setN(2);
        ChatCompletionRequest badNew = request(message("user", "Again"));
        badNew.setSessionId("fresh");
        badNew.setModel("unknown-model");

        assertThatThrownBy(() -> translator.translate(bad, HeaderOptions.none())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> translator.translate(badNew, HeaderOptions.none()))
                .isInstanceOf(UnsupportedModelException.class);
        assertThat(sessionStore.get("keep").orElseThrow().getMessageCount()).isEqualTo(1);
        assertThat(sessionStore.get("fresh")).isEmpty();
    }

    @Test
    void toolChoiceNoneDisablesTools() throws Exception {
        ChatCompletionRequest request = request(message("user", "Weather?"));
        request.setTools(List.of(json("""
                {"type": "function", "function": {"name": "get_weather", "parameters": {"type": "object"}}}
                """)));
        request.setToolChoice(TextNode.valueOf("none"));

        InvocationDescriptor descriptor = translator.translate(request, HeaderOptions.none()).getDescriptor();

        assertThat(descriptor.getToolConfig().isEnabled()).isFalse();
        assertThat(descriptor.getSystemPrompt()).isNull();
    }

    @Test
    void declaredToolsAreDescribedInTheSystemPrompt() throws Exception {
        ChatCompletionRequest request = request(message("system", "Helpful."), message("user", "Weather?"));
        request.setTools(List.of(json("""
                {"type": "function", "function": {"name": "get_weather", "description": "Current weather"}}
                """)));

        InvocationDescriptor descriptor = translator.translate(request, HeaderOptions.none()).getDescriptor();

        assertThat(descriptor.getToolConfig().isEnabled()).isTrue();
        assertThat(descriptor.getSystemPrompt()).startsWith("Helpful.\n\n").contains("get_weather");
    }

    @Test
    void toolResultsAreRenderedAsHumanTurns() {
        ChatMessage call = ChatMessage.builder()
                .role("assistant")
                .toolCalls(List.of(ToolCall.function("call_1", "get_weather", "{\"city\":\"Oslo\"}")))
                .build();
        ChatMessage result = ChatMessage.builder()
                .role("tool").toolCallId("call_1").content(TextNode.valueOf("Sunny")).build();

        InvocationDescriptor descriptor = translator.translate(
                request(message("user", "Weather in Oslo?"), call, result), HeaderOptions.none()).getDescriptor();

        assertThat(descriptor.getPrompt()).isEqualTo("Human: Weather in Oslo?\n\n"
                + "Assistant: [Requested function get_weather with arguments {\"city\":\"Oslo\"} as call call_1]\n\n"
                + "Human: Result of function call call_1:\nSunny");
    }

    @Test
    void trailingAssistantTurnGetsContinuationPrompt() {
        InvocationDescriptor descriptor = translator.translate(
                request(message("user", "Start"), message("assistant", "Once upon")), HeaderOptions.none()).getDescriptor();

        assertThat(descriptor.getPrompt()).endsWith("Assistant: Once upon\n\nHuman: Please continue.");
    }

    @Test
    void headerOptionsReachTheDescriptor() throws Exception {
        ChatCompletionRequest request = request(message("user", "Refactor"));
        request.setTools(List.of(json("""
                {"type": "function", "function": {"name": "noop"}}
                """)));
        HeaderOptions options = new HeaderOptions(5, List.of("Read"), List.of(), "acceptEdits", 2000, List.of());

        InvocationDescriptor descriptor = translator.translate(request, options).getDescriptor();

        assertThat(descriptor.getMaxTurns()).isEqualTo(5);
        assertThat(descriptor.getPermissionMode()).isEqualTo("acceptEdits");
        assertThat(descriptor.getMaxThinkingTokens()).isEqualTo(2000);
        assertThat(descriptor.getToolConfig().getAllowedTools()).containsExactly("Read");
    }

    @Test
    void toolPolicyOverridesHeaderMaxTurns() {
        HeaderOptions options = new HeaderOptions(8, List.of(), List.of(), null, null, List.of());

        InvocationDescriptor descriptor = translator.translate(request(message("user", "Hi")), options).getDescriptor();

        assertThat(descriptor.getMaxTurns()).isEqualTo(1);
        assertThat(descriptor.getWarnings()).anySatisfy(warning -> assertThat(warning).startsWith(HeaderOptions.MAX_TURNS));
    }

    @Test
    void logitBiasIsIgnoredWithWarning() {
        ChatCompletionRequest request = request(message("user", "Hi"));
        request.setLogitBias(Map.of("50256", -100));

        assertThat(translator.translate(request, HeaderOptions.none()).getDescriptor().getWarnings())
                .anySatisfy(warning -> assertThat(warning).startsWith("logit_bias"));
    }
}
