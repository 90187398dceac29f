package com.chatbridge.tools;

import com.chatbridge.exception.ValidationException;
import com.chatbridge.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Converts between the wire tool-calling schema and the backend's tool permissions.
 * Nothing here executes a tool.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolCallBridge {

    /**
     * Tools the backend can run on its own. They stay blocked unless the caller opted in.
     */
    public static final List<String> BUILTIN_TOOLS = List.of(
            "Task", "Bash", "Glob", "Grep", "LS", "exit_plan_mode", "Read", "Edit", "MultiEdit", "Write",
            "NotebookRead", "NotebookEdit", "WebFetch", "TodoRead", "TodoWrite", "WebSearch"
    );

    static final String MARKUP_TAG = "tool_call";

    private final ObjectMapper mapper;

    public List<WireTool> classify(List<JsonNode> rawTools) {
        List<WireTool> classified = new ArrayList<>();
        if (rawTools == null) {
            return classified;
        }
        for (int i = 0; i < rawTools.size(); i++) {
            JsonNode raw = rawTools.get(i);
            String type = raw == null ? "" : raw.path("type").asText("");
            if (!"function".equals(type)) {
                classified.add(new UnknownTool(i, type));
                continue;
            }
            JsonNode function = raw.path("function");
            String name = function.path("name").asText("");
            if (name.isBlank()) {
                throw ValidationException.of("tools[" + i + "].function.name", "Tool function name is required");
            }
            JsonNode parameters = function.has("parameters") ? function.get("parameters") : mapper.createObjectNode();
            classified.add(new ToolDefinition(name, function.path("description").asText(""), parameters));
        }
        return classified;
    }

    public List<ToolDefinition> parseTools(List<JsonNode> rawTools) {
        List<ToolDefinition> definitions = new ArrayList<>();
        List<ValidationException.FieldError> errors = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (WireTool tool : classify(rawTools)) {
            if (tool instanceof ToolDefinition definition) {
                if (!names.add(definition.getName())) {
                    errors.add(new ValidationException.FieldError("tools",
                            "Duplicate tool name '" + definition.getName() + "'"));
                }
                definitions.add(definition);
            } else if (tool instanceof UnknownTool unknown) {
                errors.add(new ValidationException.FieldError("tools[" + unknown.getPosition() + "].type",
                        "Unsupported tool type '" + unknown.getType() + "'; only 'function' is accepted"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid tools definition", errors);
        }
        return definitions;
    }

    public ToolChoice parseToolChoice(JsonNode node, List<ToolDefinition> tools) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return tools.isEmpty() ? ToolChoice.NONE : ToolChoice.AUTO;
        }
        if (node.isTextual()) {
            return switch (node.asText()) {
                case "none" -> ToolChoice.NONE;
                case "auto" -> ToolChoice.AUTO;
                case "required" -> {
                    log.warn("tool_choice 'required' cannot be enforced by the backend; treating as 'auto'");
                    yield ToolChoice.AUTO;
                }
                default -> throw ValidationException.of("tool_choice",
                        "tool_choice must be 'none', 'auto', 'required' or a function object");
            };
        }
        String name = node.path("function").path("name").asText("");
        if (!"function".equals(node.path("type").asText()) || name.isBlank()) {
            throw ValidationException.of("tool_choice", "tool_choice object must name a function");
        }
        if (tools.stream().noneMatch(tool -> tool.getName().equals(name))) {
            throw ValidationException.of("tool_choice.function.name",
                    "tool_choice references undeclared function '" + name + "'");
        }
        return ToolChoice.forced(name);
    }

    public BackendToolConfig toBackendConfig(List<ToolDefinition> tools, ToolChoice toolChoice) {
        if (tools == null || tools.isEmpty() || toolChoice == null || toolChoice.disablesTools()) {
            log.debug("Backend tool execution disabled toolCount={} choice={}",
                    tools == null ? 0 : tools.size(), toolChoice);
            return BackendToolConfig.builder()
                    .enabled(false)
                    .choice(ToolChoice.NONE)
                    .disallowedTools(BUILTIN_TOOLS)
                    .maxTurns(1)
                    .build();
        }
        log.debug("Client functions enabled count={} choice={}", tools.size(), toolChoice.getMode());
        return BackendToolConfig.builder()
                .enabled(true)
                .choice(toolChoice)
                .functions(tools)
                .disallowedTools(BUILTIN_TOOLS)
                .maxTurns(1)
                .build();
    }

    /**
     * Applies the caller's built-in tool allow/deny lists. Allow lists only count when the request
     * opted into tools on the wire.
     */
    public BackendToolConfig withRequestedPermissions(BackendToolConfig config,
                                                      List<String> allowed,
                                                      List<String> disallowed) {
        if (!config.isEnabled()) {
            if (!allowed.isEmpty()) {
                log.warn("Ignoring allowed tools {} because the request did not enable tools", allowed);
            }
            return config;
        }
        if (allowed.isEmpty() && disallowed.isEmpty()) {
            return config;
        }
        Set<String> blocked = new LinkedHashSet<>(BUILTIN_TOOLS);
        blocked.removeAll(allowed);
        blocked.addAll(disallowed);
        return config.toBuilder()
                .clearAllowedTools()
                .allowedTools(allowed)
                .clearDisallowedTools()
                .disallowedTools(blocked)
                .maxTurns(allowed.isEmpty() ? config.getMaxTurns() : null)
                .build();
    }

    public String describeFunctions(BackendToolConfig config) {
        if (!config.isEnabled() || config.getFunctions().isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        out.append("You can request the following functions. You cannot run them yourself; the caller runs them ")
                .append("and replies with the result.\n");
        for (ToolDefinition function : config.getFunctions()) {
            out.append("\n- ").append(function.getName());
            if (!function.getDescription().isBlank()) {
                out.append(": ").append(function.getDescription());
            }
            out.append("\n  parameters: ").append(function.getParameters().toString());
        }
        out.append("\n\nTo request a call, reply with one block per call and nothing after the last block:\n")
                .append('<').append(MARKUP_TAG).append(">{\"name\": \"<function>\", \"arguments\": {...}}</")
                .append(MARKUP_TAG).append(">");
        if (config.getChoice().getMode() == ToolChoice.Mode.FORCED) {
            out.append("\n\nYou must call the function '").append(config.getChoice().getFunctionName())
                    .append("' in this reply.");
        }
        return out.toString();
    }

    public List<ToolCall> fromBackendOutput(JsonNode assistantMessage) {
        List<ToolCall> calls = new ArrayList<>();
        JsonNode content = assistantMessage == null ? null : assistantMessage.path("content");
        if (content == null || !content.isArray()) {
            return calls;
        }
        for (JsonNode block : content) {
            if ("tool_use".equals(block.path("type").asText())) {
                String name = block.path("name").asText("");
                if (name.isBlank()) {
                    log.warn("Skipping tool_use block without a name");
                    continue;
                }
                calls.add(ToolCall.function(newCallId(), name, block.path("input").isMissingNode()
                        ? "{}" : block.path("input").toString()));
            }
        }
        return calls;
    }

    public Optional<ToolCall> fromMarkup(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body == null ? "" : body.trim());
        } catch (JsonProcessingException ex) {
            log.warn("Discarding malformed tool_call markup: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject() || node.path("name").asText("").isBlank()) {
            log.warn("Discarding tool_call markup without a function name");
            return Optional.empty();
        }
        JsonNode arguments = node.path("arguments");
        String argumentsJson;
        if (arguments.isMissingNode() || arguments.isNull()) {
            argumentsJson = "{}";
        } else if (arguments.isTextual()) {
            argumentsJson = arguments.asText();
        } else {
            argumentsJson = arguments.toString();
        }
        return Optional.of(ToolCall.function(newCallId(), node.path("name").asText(), argumentsJson));
    }

    public static String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
