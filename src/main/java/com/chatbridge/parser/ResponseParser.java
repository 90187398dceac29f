package com.chatbridge.parser;

import com.chatbridge.exception.BackendInvocationException;
import com.chatbridge.model.FinishReason;
import com.chatbridge.model.ToolCall;
import com.chatbridge.tools.BackendToolConfig;
import com.chatbridge.tools.ToolCallBridge;
import com.chatbridge.tools.ToolChoice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the backend's line-delimited JSON output.
 *
 * <p>Recognised event types: {@code system} (ignored), {@code stream_event} (partial text deltas),
 * {@code assistant} (full message with text and {@code tool_use} blocks) and {@code result}
 * (final text, stop subtype and usage). A line that is not JSON is plain text.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseParser {

    static final String IMAGE_PLACEHOLDER = "[Image: Content not supported]";

    private static final Pattern IMAGE_REFERENCE = Pattern.compile(
            "\\[Image:[^\\]]*\\]|data:image/[a-zA-Z0-9.+-]+;base64,[A-Za-z0-9+/=]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private static final BackendToolConfig NO_TOOLS = BackendToolConfig.builder()
            .enabled(false)
            .choice(ToolChoice.NONE)
            .build();

    private final ObjectMapper mapper;
    private final ToolCallBridge toolCallBridge;

    public ParserState newState(BackendToolConfig toolConfig, int promptTokens) {
        return new ParserState(toolConfig == null ? NO_TOOLS : toolConfig, promptTokens);
    }

    public ParsedResponse parseComplete(String raw) {
        return parseComplete(raw, NO_TOOLS, 0);
    }

    public ParsedResponse parseComplete(String raw, BackendToolConfig toolConfig, int promptTokens) {
        ParserState state = newState(toolConfig, promptTokens);
        if (raw != null) {
            for (String line : raw.split("\\R")) {
                parseIncremental(line, state);
            }
        }
        finish(state);
        return summarize(state, true);
    }

    /**
     * Parses one backend output line into the state and returns what it added.
     * A line that cannot be parsed is logged and skipped.
     *
     * @throws BackendInvocationException when the backend reports a failed run
     */
    public ParsedDelta parseIncremental(String rawChunk, ParserState state) {
        if (rawChunk == null || rawChunk.isBlank()) {
            return ParsedDelta.EMPTY;
        }
        String line = rawChunk.strip();
        JsonNode event;
        if (line.startsWith("{")) {
            try {
                event = mapper.readTree(line);
            } catch (JsonProcessingException ex) {
                state.recordSkipped();
                log.warn("Skipping unparseable backend chunk length={}: {}", line.length(), ex.getOriginalMessage());
                return ParsedDelta.SKIPPED;
            }
        } else {
            state.markTextSeen();
            return accept(state, rawChunk + "\n", List.of());
        }

        try {
            return switch (event.path("type").asText("")) {
                case "stream_event" -> onStreamEvent(event.path("event"), state);
                case "assistant" -> onAssistant(event.path("message"), state);
                case "result" -> onResult(event, state);
                default -> {
                    log.trace("Ignoring backend event type='{}'", event.path("type").asText(""));
                    yield ParsedDelta.EMPTY;
                }
            };
        } catch (BackendInvocationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            state.recordSkipped();
            log.warn("Skipping backend chunk after parse failure type='{}'", event.path("type").asText(""), ex);
            return ParsedDelta.SKIPPED;
        }
    }

    public ParsedDelta finish(ParserState state) {
        if (state.isFinished()) {
            return ParsedDelta.EMPTY;
        }
        List<ToolCall> calls = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        if (!state.isTextSeen() && state.getResultText() != null && !state.getResultText().isEmpty()) {
            MarkupFilter.Output output = state.getMarkupFilter().feed(state.getResultText());
            text.append(output.getText());
            collect(state, output, calls);
        }
        MarkupFilter.Output tail = state.getMarkupFilter().finish();
        text.append(tail.getText());
        collect(state, tail, calls);
        state.markFinished();
        state.getContent().append(text);
        state.getToolCalls().addAll(calls);
        return new ParsedDelta(text.toString(), calls, false);
    }

    public ParsedResponse summarize(ParserState state, boolean sanitize) {
        String content = state.contentSoFar();
        if (sanitize) {
            content = sanitize(content);
        }
        List<ToolCall> calls = List.copyOf(state.getToolCalls());
        FinishReason finishReason;
        if (!calls.isEmpty()) {
            finishReason = FinishReason.TOOL_CALLS;
        } else if (state.getFinishHint() != null) {
            finishReason = state.getFinishHint();
        } else {
            finishReason = FinishReason.STOP;
        }
        return ParsedResponse.builder()
                .content(content)
                .toolCalls(calls)
                .usage(usage(state, content, calls))
                .finishReason(finishReason)
                .warnings(state.getWarnings())
                .skippedChunks(state.getSkippedChunks())
                .build();
    }

    static String sanitize(String content) {
        String cleaned = IMAGE_REFERENCE.matcher(content).replaceAll(IMAGE_PLACEHOLDER);
        cleaned = EXCESS_NEWLINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }

    private TokenUsage usage(ParserState state, String content, List<ToolCall> calls) {
        if (state.getReportedUsage() != null) {
            return state.getReportedUsage();
        }
        StringBuilder completion = new StringBuilder(content);
        for (ToolCall call : calls) {
            completion.append(call.getName()).append(call.getArguments());
        }
        return TokenUsage.estimated(state.getPromptTokens(), completion.toString());
    }

    private ParsedDelta onStreamEvent(JsonNode event, ParserState state) {
        String type = event.path("type").asText("");
        if ("message_start".equals(type)) {
            state.markPartialMessageSeen(false);
            return ParsedDelta.EMPTY;
        }
        if (!"content_block_delta".equals(type)) {
            return ParsedDelta.EMPTY;
        }
        JsonNode delta = event.path("delta");
        if (!"text_delta".equals(delta.path("type").asText(""))) {
            return ParsedDelta.EMPTY;
        }
        state.markPartialMessageSeen(true);
        state.markTextSeen();
        return accept(state, delta.path("text").asText(""), List.of());
    }

    private ParsedDelta onAssistant(JsonNode message, ParserState state) {
        List<ToolCall> calls = toolCallBridge.fromBackendOutput(message);
        StringBuilder text = new StringBuilder();
        if (!state.isPartialMessageSeen()) {
            for (JsonNode block : message.path("content")) {
                if ("text".equals(block.path("type").asText(""))) {
                    text.append(block.path("text").asText(""));
                }
            }
        }
        // partial deltas already carried this message's text
        state.markPartialMessageSeen(false);
        if (text.length() > 0) {
            state.markTextSeen();
        }
        return accept(state, text.toString(), calls);
    }

    private ParsedDelta onResult(JsonNode event, ParserState state) {
        String subtype = event.path("subtype").asText("");
        boolean isError = event.path("is_error").asBoolean(false);
        FinishReason hint = null;
        if ("error_max_turns".equals(subtype)) {
            hint = FinishReason.LENGTH;
        } else if (isError || subtype.startsWith("error")) {
            throw new BackendInvocationException("Backend run failed subtype=" + subtype);
        }
        TokenUsage usage = null;
        JsonNode usageNode = event.path("usage");
        if (usageNode.has("input_tokens") && usageNode.has("output_tokens")) {
            usage = TokenUsage.exact(usageNode.path("input_tokens").asInt(), usageNode.path("output_tokens").asInt());
        }
        state.recordResult(event.path("result").isTextual() ? event.path("result").asText() : null, usage, hint);
        log.debug("Backend result subtype={} exactUsage={} turns={}", subtype, usage != null,
                event.path("num_turns").asInt(0));
        return ParsedDelta.EMPTY;
    }

    private ParsedDelta accept(ParserState state, String text, List<ToolCall> backendCalls) {
        List<ToolCall> calls = new ArrayList<>();
        for (ToolCall call : backendCalls) {
            admit(state, call, calls);
        }
        MarkupFilter.Output output = state.getMarkupFilter().feed(text);
        collect(state, output, calls);
        state.getContent().append(output.getText());
        state.getToolCalls().addAll(calls);
        return new ParsedDelta(output.getText(), calls, false);
    }

    private void collect(ParserState state, MarkupFilter.Output output, List<ToolCall> calls) {
        for (String warning : output.getWarnings()) {
            log.warn("Markup parse warning: {}", warning);
            state.getWarnings().add(warning);
        }
        for (String body : output.getToolCallBodies()) {
            toolCallBridge.fromMarkup(body).ifPresent(call -> admit(state, call, calls));
        }
    }

    private void admit(ParserState state, ToolCall call, List<ToolCall> calls) {
        BackendToolConfig config = state.getToolConfig();
        if (!config.isEnabled()) {
            log.warn("Dropping tool request '{}' because tools are disabled for this request", call.getName());
            return;
        }
        if (!config.declares(call.getName())) {
            log.debug("Not surfacing backend tool '{}' (not a declared client function)", call.getName());
            return;
        }
        calls.add(call);
    }
}
