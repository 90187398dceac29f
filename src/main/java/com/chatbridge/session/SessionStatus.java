package com.chatbridge.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    ACTIVE, EXPIRED, DELETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
