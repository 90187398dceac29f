package com.chatbridge.auth;

import java.util.Locale;

public enum AuthMethod {
    BEDROCK, VERTEX, ANTHROPIC, CLI, NONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
