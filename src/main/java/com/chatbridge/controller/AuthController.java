package com.chatbridge.controller;

import com.chatbridge.auth.AuthResolver;
import com.chatbridge.auth.AuthStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "Authentication")
@RestController
@RequestMapping("/v1/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthResolver authResolver;

    @Operation(summary = "Backend credential status", description = "refresh=true re-runs detection instead of using the cached result.")
    @GetMapping("/status")
    public Mono<Map<String, Object>> status(@RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        return Mono.fromCallable(() -> {
                    if (refresh) {
                        authResolver.invalidate();
                    }
                    return toBody(authResolver.detect());
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(body -> log.debug("Auth status served method={} valid={} refresh={}",
                        body.get("method"), body.get("valid"), refresh));
    }

    private static Map<String, Object> toBody(AuthStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("method", status.getMethod().wireName());
        body.put("valid", status.isValid());
        body.put("errors", status.getErrors());
        body.put("environment_variables_present", status.getEnvironmentVariablesPresent());
        body.put("config", status.getConfig());
        body.put("checked_at", status.getCheckedAt() != null ? status.getCheckedAt().toString() : null);
        return body;
    }
}
