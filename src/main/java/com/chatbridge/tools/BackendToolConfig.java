package com.chatbridge.tools;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Tool permissions handed to the backend for one invocation.
 *
 * <p>{@code functions} are the caller's client-side functions: the backend may only ask for them,
 * never run them. {@code allowedTools}/{@code disallowedTools} govern the backend's built-in tools.</p>
 */
@Value
@Builder(toBuilder = true)
public class BackendToolConfig {
    boolean enabled;
    ToolChoice choice;
    @Singular
    List<ToolDefinition> functions;
    @Singular
    List<String> allowedTools;
    @Singular
    List<String> disallowedTools;
    /**
     * Turn ceiling forced by the tool policy; {@code null} leaves it to headers or the backend default.
     */
    Integer maxTurns;

    public boolean declares(String functionName) {
        return functions.stream().anyMatch(function -> function.getName().equals(functionName));
    }
}
