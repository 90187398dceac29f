package com.chatbridge.controller;

import com.chatbridge.model.ChatCompletionRequest;
import com.chatbridge.service.ChatCompletionService;
import com.chatbridge.translate.HeaderOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

@Tag(name = "Chat Completions")
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatCompletionService chatService;
    private final ObjectMapper mapper;

    @Operation(
            summary = "Create a chat completion",
            description = "OpenAI-compatible. Returns JSON, or text/event-stream chunks ending in [DONE] when stream=true."
    )
    @PostMapping(value = "/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Void> chatCompletions(@RequestBody ChatCompletionRequest request,
                                      @RequestHeader HttpHeaders headers,
                                      ServerHttpResponse response) {
        HeaderOptions options = HeaderOptions.from(headers);
        log.debug("Handling /v1/chat/completions model={} stream={} sessionId={} messages={}",
                request.getModel(), request.isStreaming(), request.getSessionId(),
                request.getMessages() != null ? request.getMessages().size() : 0);

        if (request.isStreaming()) {
            return chatService.stream(request, options)
                    .flatMap(frames -> writeEventStream(response, frames, request.getModel()))
                    .doOnError(error -> log.error("chat stream rejected model={}", request.getModel(), error));
        }
        return chatService.complete(request, options)
                .flatMap(body -> {
                    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    return response.writeWith(Mono.fromCallable(() ->
                            response.bufferFactory().wrap(mapper.writeValueAsBytes(body))));
                })
                .doOnError(error -> log.error("chat completion failed model={}", request.getModel(), error));
    }

    private Mono<Void> writeEventStream(ServerHttpResponse response, Flux<String> frames, String model) {
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(MediaType.TEXT_EVENT_STREAM);
        headers.setCacheControl(CacheControl.noCache());
        headers.set(HttpHeaders.CONNECTION, "keep-alive");
        headers.set("X-Accel-Buffering", "no");
        return response.writeAndFlushWith(frames
                .doOnSubscribe(subscription -> log.debug("Subscribed to chat stream model={}", model))
                .doOnNext(frame -> log.trace("chat stream frame model={} length={}", model, frame.length()))
                .doOnComplete(() -> log.debug("chat stream completed model={}", model))
                .doOnCancel(() -> log.debug("chat stream cancelled by client model={}", model))
                .map(frame -> Mono.just(response.bufferFactory().wrap(frame.getBytes(StandardCharsets.UTF_8)))));
    }
}
