package com.chatbridge.exception;

import lombok.Getter;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.util.List;

@Getter
public class ValidationException extends BridgeException {

    private final List<FieldError> details;

    public ValidationException(String message, List<FieldError> details) {
        super(HttpStatus.BAD_REQUEST, "invalid_request_error", "validation_error", message);
        this.details = List.copyOf(details);
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(message, List.of(new FieldError(field, message)));
    }

    @Value
    public static class FieldError {
        String field;
        String message;
    }
}
