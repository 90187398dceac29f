package com.chatbridge.service;

import com.chatbridge.model.ChatCompletionRequest;
import com.chatbridge.model.ChatCompletionResponse;
import com.chatbridge.translate.HeaderOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ChatCompletionService {

    Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, HeaderOptions headers);

    /**
     * Resolves to the SSE frames once the request has been accepted. Validation and authentication
     * failures error the outer {@link Mono}; the inner stream itself never errors.
     */
    Mono<Flux<String>> stream(ChatCompletionRequest request, HeaderOptions headers);
}
