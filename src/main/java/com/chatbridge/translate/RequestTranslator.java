package com.chatbridge.translate;

import com.chatbridge.exception.SessionNotFoundException;
import com.chatbridge.exception.UnsupportedModelException;
import com.chatbridge.exception.ValidationException;
import com.chatbridge.model.ChatCompletionRequest;
import com.chatbridge.model.ChatMessage;
import com.chatbridge.model.Message;
import com.chatbridge.model.Role;
import com.chatbridge.model.ToolCall;
import com.chatbridge.parser.TokenEstimator;
import com.chatbridge.session.Session;
import com.chatbridge.session.SessionStore;
import com.chatbridge.tools.BackendToolConfig;
import com.chatbridge.tools.ToolCallBridge;
import com.chatbridge.tools.ToolChoice;
import com.chatbridge.tools.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns an OpenAI-style request into a backend invocation.
 *
 * <p>Everything that can reject the request runs before the session is touched, so a rejected
 * request leaves no trace in the store.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestTranslator {

    static final String CONTINUATION_PROMPT = "Please continue.";
    static final String IMAGE_PLACEHOLDER = "[Image: Content not supported]";

    private final ModelRegistry modelRegistry;
    private final SessionStore sessionStore;
    private final ToolCallBridge toolCallBridge;

    public TranslatedRequest translate(ChatCompletionRequest request, HeaderOptions headers) {
        HeaderOptions options = headers == null ? HeaderOptions.none() : headers;
        List<String> warnings = new ArrayList<>(options.getWarnings());

        validateModel(request);
        List<Message> incoming = normalizeMessages(request.getMessages());
        validateParameters(request, warnings);
        List<ToolDefinition> tools = toolCallBridge.parseTools(request.getTools());
        ToolChoice toolChoice = toolCallBridge.parseToolChoice(request.getToolChoice(), tools);

        Session session = null;
        List<Message> merged = new ArrayList<>();
        if (StringUtils.hasText(request.getSessionId())) {
            session = attachSession(request.getSessionId(), request.getModel(), incoming, options);
            List<Message> history = session.getMessages();
            try {
                sessionStore.appendMessages(session.getId(), incoming);
            } catch (SessionNotFoundException ex) {
                log.info("Session {} closed while the request was attached; starting it again", session.getId());
                session = attachSession(request.getSessionId(), request.getModel(), incoming, options);
                history = session.getMessages();
                sessionStore.appendMessages(session.getId(), incoming);
            }
            merged.addAll(history);
            log.debug("Session continuation sessionId={} history={} incoming={}",
                    session.getId(), history.size(), incoming.size());
        }
        merged.addAll(incoming);

        BackendToolConfig toolConfig = toolCallBridge.toBackendConfig(tools, toolChoice);
        toolConfig = toolCallBridge.withRequestedPermissions(toolConfig, options.getAllowedTools(),
                options.getDisallowedTools());

        Integer maxTurns = options.getMaxTurns();
        if (toolConfig.getMaxTurns() != null) {
            if (maxTurns != null && !maxTurns.equals(toolConfig.getMaxTurns())) {
                warnings.add(HeaderOptions.MAX_TURNS + " ignored; tool policy limits the backend to "
                        + toolConfig.getMaxTurns() + " turn(s)");
            }
            maxTurns = toolConfig.getMaxTurns();
        }

        String systemPrompt = renderSystemPrompt(merged, session, toolConfig);
        String prompt = renderPrompt(merged);

        for (String warning : warnings) {
            log.warn("Compatibility warning model={}: {}", request.getModel(), warning);
        }

        InvocationDescriptor descriptor = InvocationDescriptor.builder()
                .requestId(UUID.randomUUID().toString())
                .model(request.getModel())
                .systemPrompt(systemPrompt)
                .prompt(prompt)
                .messages(merged)
                .incomingMessages(incoming)
                .toolConfig(toolConfig)
                .maxTurns(maxTurns)
                .permissionMode(options.getPermissionMode())
                .maxThinkingTokens(options.getMaxThinkingTokens())
                .stream(request.isStreaming())
                .sessionId(session != null ? session.getId() : null)
                .promptTokens(TokenEstimator.estimate(systemPrompt) + TokenEstimator.estimate(prompt))
                .warnings(warnings)
                .build();
        log.debug("Translated request requestId={} model={} messages={} stream={} toolsEnabled={}",
                descriptor.getRequestId(), descriptor.getModel(), merged.size(), descriptor.isStream(),
                toolConfig.isEnabled());
        return new TranslatedRequest(descriptor, session);
    }

    private Session attachSession(String sessionId, String model, List<Message> incoming, HeaderOptions options) {
        Session session = sessionStore.get(sessionId)
                .orElseGet(() -> sessionStore.create(sessionId, model, firstSystemPrompt(incoming).orElse(null)));
        if (options.getMaxTurns() != null) {
            session.setMaxTurns(options.getMaxTurns());
        }
        return session;
    }

    private void validateModel(ChatCompletionRequest request) {
        if (!StringUtils.hasText(request.getModel())) {
            throw ValidationException.of("model", "model is required");
        }
        if (!modelRegistry.isSupported(request.getModel())) {
            throw new UnsupportedModelException(request.getModel(), modelRegistry.supportedModels());
        }
    }

    List<Message> normalizeMessages(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw ValidationException.of("messages", "messages must contain at least one message");
        }
        List<ValidationException.FieldError> errors = new ArrayList<>();
        List<Message> normalized = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            String field = "messages[" + i + "]";
            ChatMessage message = messages.get(i);
            if (message == null) {
                errors.add(new ValidationException.FieldError(field, "message must be an object"));
                continue;
            }
            Optional<Role> role = Role.fromWire(message.getRole());
            if (role.isEmpty()) {
                errors.add(new ValidationException.FieldError(field + ".role",
                        "role must be one of system, user, assistant, tool"));
                continue;
            }
            String content;
            try {
                content = contentText(message.getContent());
            } catch (IllegalArgumentException ex) {
                errors.add(new ValidationException.FieldError(field + ".content", ex.getMessage()));
                continue;
            }
            boolean hasToolCalls = message.getToolCalls() != null && !message.getToolCalls().isEmpty();
            if (hasToolCalls && role.get() != Role.ASSISTANT) {
                errors.add(new ValidationException.FieldError(field + ".tool_calls",
                        "only assistant messages may carry tool_calls"));
            }
            if (content == null && !(role.get() == Role.ASSISTANT && hasToolCalls)) {
                errors.add(new ValidationException.FieldError(field + ".content", "content is required"));
            }
            if (role.get() == Role.TOOL && !StringUtils.hasText(message.getToolCallId())) {
                errors.add(new ValidationException.FieldError(field + ".tool_call_id",
                        "tool messages must reference a tool_call_id"));
            }
            if (hasToolCalls) {
                for (int j = 0; j < message.getToolCalls().size(); j++) {
                    ToolCall call = message.getToolCalls().get(j);
                    if (call == null || !StringUtils.hasText(call.getId()) || !StringUtils.hasText(call.getName())) {
                        errors.add(new ValidationException.FieldError(field + ".tool_calls[" + j + "]",
                                "tool call needs an id and a function name"));
                    }
                }
            }
            normalized.add(Message.builder()
                    .role(role.get())
                    .content(content)
                    .name(message.getName())
                    .toolCalls(hasToolCalls ? List.copyOf(message.getToolCalls()) : null)
                    .toolCallId(role.get() == Role.TOOL ? message.getToolCallId() : null)
                    .build());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid messages", errors);
        }
        return normalized;
    }

    private static String contentText(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : content) {
                String type = part.path("type").asText("");
                switch (type) {
                    case "text" -> parts.add(part.path("text").asText(""));
                    case "image_url", "image" -> parts.add(IMAGE_PLACEHOLDER);
                    default -> throw new IllegalArgumentException("unsupported content part type '" + type + "'");
                }
            }
            return String.join("\n", parts);
        }
        throw new IllegalArgumentException("content must be a string or an array of content parts");
    }

    private void validateParameters(ChatCompletionRequest request, List<String> warnings) {
        List<ValidationException.FieldError> errors = new ArrayList<>();
        if (request.getN() != null && request.getN() != 1) {
            errors.add(new ValidationException.FieldError("n", "only a single choice (n=1) is supported"));
        }
        checkRange("temperature", request.getTemperature(), 0.0, 2.0, errors, warnings);
        checkRange("top_p", request.getTopP(), 0.0, 1.0, errors, warnings);
        checkRange("presence_penalty", request.getPresencePenalty(), -2.0, 2.0, errors, warnings);
        checkRange("frequency_penalty", request.getFrequencyPenalty(), -2.0, 2.0, errors, warnings);
        if (request.getMaxTokens() != null) {
            if (request.getMaxTokens() < 1) {
                errors.add(new ValidationException.FieldError("max_tokens", "must be at least 1"));
            } else {
                warnings.add("max_tokens is not supported by the backend and was ignored");
            }
        }
        if (request.getLogitBias() != null && !request.getLogitBias().isEmpty()) {
            warnings.add("logit_bias is not supported by the backend and was ignored");
        }
        if (request.getStop() != null && !request.getStop().isNull()) {
            warnings.add("stop sequences are not supported by the backend and were ignored");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid request parameters", errors);
        }
    }

    private static void checkRange(String field, Double value, double min, double max,
                                   List<ValidationException.FieldError> errors, List<String> warnings) {
        if (value == null) {
            return;
        }
        if (value < min || value > max) {
            errors.add(new ValidationException.FieldError(field, "must be between " + min + " and " + max));
        } else {
            warnings.add(field + " is not supported by the backend and was ignored");
        }
    }

    private String renderSystemPrompt(List<Message> merged, Session session, BackendToolConfig toolConfig) {
        String system = merged.stream()
                .filter(message -> message.getRole() == Role.SYSTEM && StringUtils.hasText(message.getContent()))
                .map(Message::getContent)
                .collect(Collectors.joining("\n\n"));
        if (system.isEmpty() && session != null && StringUtils.hasText(session.getSystemPrompt())) {
            system = session.getSystemPrompt();
        }
        String functions = toolCallBridge.describeFunctions(toolConfig);
        if (functions.isEmpty()) {
            return system.isEmpty() ? null : system;
        }
        return system.isEmpty() ? functions : system + "\n\n" + functions;
    }

    String renderPrompt(List<Message> merged) {
        List<String> turns = new ArrayList<>();
        Role last = null;
        for (Message message : merged) {
            switch (message.getRole()) {
                case SYSTEM -> {
                    continue;
                }
                case USER -> turns.add("Human: " + message.getContent());
                case ASSISTANT -> turns.add("Assistant: " + assistantTurn(message));
                case TOOL -> turns.add("Human: Result of function call " + message.getToolCallId() + ":\n"
                        + message.getContent());
            }
            last = message.getRole();
        }
        if (last != Role.USER && last != Role.TOOL) {
            turns.add("Human: " + CONTINUATION_PROMPT);
        }
        return String.join("\n\n", turns);
    }

    private static String assistantTurn(Message message) {
        StringBuilder turn = new StringBuilder();
        if (StringUtils.hasText(message.getContent())) {
            turn.append(message.getContent());
        }
        if (message.hasToolCalls()) {
            for (ToolCall call : message.getToolCalls()) {
                if (turn.length() > 0) {
                    turn.append('\n');
                }
                turn.append("[Requested function ").append(call.getName())
                        .append(" with arguments ").append(call.getArguments())
                        .append(" as call ").append(call.getId()).append(']');
            }
        }
        return turn.toString();
    }

    private static Optional<String> firstSystemPrompt(List<Message> messages) {
        return messages.stream()
                .filter(message -> message.getRole() == Role.SYSTEM)
                .map(Message::getContent)
                .filter(StringUtils::hasText)
                .findFirst();
    }
}
