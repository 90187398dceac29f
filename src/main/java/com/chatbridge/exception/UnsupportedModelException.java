package com.chatbridge.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

@Getter
public class UnsupportedModelException extends BridgeException {

    private final String model;
    private final List<String> supportedModels;

    public UnsupportedModelException(String model, List<String> supportedModels) {
        super(HttpStatus.BAD_REQUEST, "invalid_request_error", "model_not_supported",
                "Model '" + model + "' is not supported");
        this.model = model;
        this.supportedModels = List.copyOf(supportedModels);
    }
}
