package com.chatbridge.exception;

import com.chatbridge.auth.AuthMethod;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

@Getter
public class AuthenticationException extends BridgeException {

    private final AuthMethod method;
    private final List<String> errors;

    public AuthenticationException(AuthMethod method, List<String> errors) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "authentication_error", "backend_auth_unavailable",
                "No usable backend credentials (method: " + method.wireName() + ")");
        this.method = method;
        this.errors = List.copyOf(errors);
    }
}
