package com.chatbridge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FinishReason {
    STOP, TOOL_CALLS, LENGTH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
