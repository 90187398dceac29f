package com.chatbridge.exception;

import org.springframework.http.HttpStatus;

/**
 * The backend process could not be started or exited without usable output.
 * The message stays server-side; clients only see a generic error.
 */
public class BackendInvocationException extends BridgeException {

    public BackendInvocationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", "backend_error", message);
    }

    public BackendInvocationException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", "backend_error", message, cause);
    }
}
