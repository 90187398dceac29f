package com.chatbridge.translate;

import com.chatbridge.exception.ValidationException;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Value
public class HeaderOptions {

    public static final String MAX_TURNS = "X-Claude-Max-Turns";
    public static final String ALLOWED_TOOLS = "X-Claude-Allowed-Tools";
    public static final String DISALLOWED_TOOLS = "X-Claude-Disallowed-Tools";
    public static final String PERMISSION_MODE = "X-Claude-Permission-Mode";
    public static final String MAX_THINKING_TOKENS = "X-Claude-Max-Thinking-Tokens";

    static final Set<String> PERMISSION_MODES = Set.of("default", "acceptEdits", "bypassPermissions");

    private static final int MAX_TURNS_WARNING = 100;
    private static final int THINKING_TOKENS_WARNING = 50_000;

    Integer maxTurns;
    List<String> allowedTools;
    List<String> disallowedTools;
    String permissionMode;
    Integer maxThinkingTokens;
    List<String> warnings;

    public static HeaderOptions none() {
        return new HeaderOptions(null, List.of(), List.of(), null, null, List.of());
    }

    /**
     * @throws ValidationException listing every invalid header
     */
    public static HeaderOptions from(HttpHeaders headers) {
        List<ValidationException.FieldError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Integer maxTurns = parseInt(headers, MAX_TURNS, errors);
        if (maxTurns != null) {
            if (maxTurns < 1) {
                errors.add(new ValidationException.FieldError(MAX_TURNS, "must be at least 1"));
            } else if (maxTurns > MAX_TURNS_WARNING) {
                warnings.add(MAX_TURNS + " is unusually high (" + maxTurns + ")");
            }
        }

        List<String> allowed = parseList(headers.getFirst(ALLOWED_TOOLS));
        List<String> disallowed = parseList(headers.getFirst(DISALLOWED_TOOLS));
        Set<String> overlap = new LinkedHashSet<>(allowed);
        overlap.retainAll(disallowed);
        if (!overlap.isEmpty()) {
            errors.add(new ValidationException.FieldError(ALLOWED_TOOLS,
                    "tools cannot be both allowed and disallowed: " + String.join(", ", overlap)));
        }

        String permissionMode = headers.getFirst(PERMISSION_MODE);
        if (permissionMode != null) {
            permissionMode = permissionMode.trim();
            if (!PERMISSION_MODES.contains(permissionMode)) {
                errors.add(new ValidationException.FieldError(PERMISSION_MODE,
                        "must be one of default, acceptEdits, bypassPermissions"));
            }
        }

        Integer maxThinkingTokens = parseInt(headers, MAX_THINKING_TOKENS, errors);
        if (maxThinkingTokens != null) {
            if (maxThinkingTokens < 0) {
                errors.add(new ValidationException.FieldError(MAX_THINKING_TOKENS, "must not be negative"));
            } else if (maxThinkingTokens > THINKING_TOKENS_WARNING) {
                warnings.add(MAX_THINKING_TOKENS + " is unusually high (" + maxThinkingTokens + ")");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid X-Claude-* header", errors);
        }
        return new HeaderOptions(maxTurns, allowed, disallowed, permissionMode, maxThinkingTokens,
                List.copyOf(warnings));
    }

    private static Integer parseInt(HttpHeaders headers, String name, List<ValidationException.FieldError> errors) {
        String raw = headers.getFirst(name);
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            errors.add(new ValidationException.FieldError(name, "must be an integer"));
            return null;
        }
    }

    private static List<String> parseList(String raw) {
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .distinct()
                .toList();
    }
}
