package com.chatbridge.controller;

import com.chatbridge.translate.ModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Tag(name = "Models")
@RestController
@RequestMapping("/v1/models")
@Slf4j
public class ModelController {

    private final ModelRegistry modelRegistry;
    private final long created;

    public ModelController(ModelRegistry modelRegistry, Clock clock) {
        this.modelRegistry = modelRegistry;
        this.created = clock.instant().getEpochSecond();
    }

    @Operation(summary = "List supported models")
    @GetMapping
    public Mono<Map<String, Object>> list() {
        List<Map<String, Object>> data = modelRegistry.supportedModels().stream()
                .map(this::describe)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", data);
        log.debug("Listing {} model(s)", data.size());
        return Mono.just(body);
    }

    @Operation(summary = "Describe one model")
    @GetMapping("/{modelId}")
    public Mono<Map<String, Object>> get(@PathVariable String modelId) {
        if (!modelRegistry.isSupported(modelId)) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Model '" + modelId + "' not found"));
        }
        return Mono.just(describe(modelId));
    }

    private Map<String, Object> describe(String id) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("id", id);
        model.put("object", "model");
        model.put("created", created);
        model.put("owned_by", "anthropic");
        return model;
    }
}
