package com.chatbridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public abstract class BridgeException extends RuntimeException {

    private final HttpStatus status;
    private final String type;
    private final String code;

    protected BridgeException(HttpStatus status, String type, String code, String message) {
        super(message);
        this.status = status;
        this.type = type;
        this.code = code;
    }

    protected BridgeException(HttpStatus status, String type, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.type = type;
        this.code = code;
    }
}
