package com.chatbridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class SessionNotFoundException extends BridgeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(HttpStatus.NOT_FOUND, "not_found_error", "session_not_found", "Session " + sessionId + " not found");
        this.sessionId = sessionId;
    }
}
