package com.chatbridge.auth;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one credential detection pass. {@code config} only ever carries non-secret diagnostics.
 */
@Value
@Builder
public class AuthStatus {
    AuthMethod method;
    boolean valid;
    @Singular
    List<String> errors;
    @Singular("configEntry")
    Map<String, Object> config;
    @Singular("environmentVariablePresent")
    List<String> environmentVariablesPresent;
    @EqualsAndHashCode.Exclude
    Instant checkedAt;
}
