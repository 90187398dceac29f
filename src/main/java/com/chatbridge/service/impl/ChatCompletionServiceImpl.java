package com.chatbridge.service.impl;

import com.chatbridge.auth.AuthResolver;
import com.chatbridge.auth.AuthStatus;
import com.chatbridge.backend.BackendClient;
import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.AuthenticationException;
import com.chatbridge.exception.BackendInvocationException;
import com.chatbridge.exception.SessionNotFoundException;
import com.chatbridge.model.ChatCompletionRequest;
import com.chatbridge.model.ChatCompletionResponse;
import com.chatbridge.parser.ParsedResponse;
import com.chatbridge.parser.ResponseParser;
import com.chatbridge.service.ChatCompletionService;
import com.chatbridge.session.SessionStore;
import com.chatbridge.streaming.StreamingPipeline;
import com.chatbridge.translate.HeaderOptions;
import com.chatbridge.translate.InvocationDescriptor;
import com.chatbridge.translate.RequestTranslator;
import com.chatbridge.translate.TranslatedRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatCompletionServiceImpl implements ChatCompletionService {

    private final AuthResolver authResolver;
    private final RequestTranslator translator;
    private final BackendClient backendClient;
    private final ResponseParser parser;
    private final StreamingPipeline pipeline;
    private final SessionStore sessionStore;
    private final BridgeProperties properties;
    private final Clock clock;

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, HeaderOptions headers) {
        return prepare(request, headers)
                .flatMap(translated -> {
                    InvocationDescriptor descriptor = translated.getDescriptor();
                    return backendClient.complete(descriptor)
                            .timeout(requestTimeout())
                            .onErrorMap(TimeoutException.class, ex -> new BackendInvocationException(
                                    "Backend did not finish within " + requestTimeout().toMillis() + " ms", ex))
                            .map(raw -> parser.parseComplete(raw, descriptor.getToolConfig(),
                                    descriptor.getPromptTokens()))
                            .map(parsed -> {
                                recordSession(descriptor, parsed);
                                return toResponse(descriptor, parsed);
                            });
                })
                .doOnSuccess(response -> log.debug("Completion finished id={} finishReason={} totalTokens={}",
                        response.getId(), response.getChoices().get(0).getFinishReason(),
                        response.getUsage().getTotalTokens()));
    }

    @Override
    public Mono<Flux<String>> stream(ChatCompletionRequest request, HeaderOptions headers) {
        return prepare(request, headers)
                .map(translated -> pipeline.frames(translated.getDescriptor(),
                        backendClient.stream(translated.getDescriptor())));
    }

    private Mono<TranslatedRequest> prepare(ChatCompletionRequest request, HeaderOptions headers) {
        return Mono.fromCallable(() -> {
                    ensureAuthenticated();
                    return translator.translate(request, headers);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void ensureAuthenticated() {
        AuthStatus status = authResolver.detect();
        if (!status.isValid()) {
            if (properties.getAuth().isRequired()) {
                throw new AuthenticationException(status.getMethod(), status.getErrors());
            }
            log.warn("Proceeding without valid backend credentials method={} errors={}",
                    status.getMethod().wireName(), status.getErrors());
        }
    }

    private void recordSession(InvocationDescriptor descriptor, ParsedResponse parsed) {
        if (descriptor.getSessionId() == null) {
            return;
        }
        try {
            sessionStore.appendMessages(descriptor.getSessionId(), List.of(parsed.toAssistantMessage()));
        } catch (SessionNotFoundException ex) {
            log.warn("Session {} disappeared before the reply could be stored", descriptor.getSessionId());
        }
    }

    private ChatCompletionResponse toResponse(InvocationDescriptor descriptor, ParsedResponse parsed) {
        ChatCompletionResponse.Choice choice = ChatCompletionResponse.Choice.builder()
                .index(0)
                .message(parsed.toAssistantMessage())
                .finishReason(parsed.getFinishReason())
                .build();
        return ChatCompletionResponse.builder()
                .id(ChatCompletionResponse.newId())
                .created(clock.instant().getEpochSecond())
                .model(descriptor.getModel())
                .choices(List.of(choice))
                .usage(parsed.getUsage().toWire())
                .sessionId(descriptor.getSessionId())
                .build();
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(properties.getBackend().getRequestTimeoutMs());
    }
}
