package com.chatbridge.translate;

import com.chatbridge.config.BridgeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ModelRegistry {

    private final BridgeProperties properties;

    public List<String> supportedModels() {
        return List.copyOf(properties.getModels().getSupported());
    }

    public boolean isSupported(String model) {
        return model != null && properties.getModels().getSupported().contains(model);
    }
}
