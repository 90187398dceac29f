package com.chatbridge.streaming;

import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.SessionNotFoundException;
import com.chatbridge.model.ChatCompletionResponse;
import com.chatbridge.parser.ParsedDelta;
import com.chatbridge.parser.ParsedResponse;
import com.chatbridge.parser.ParserState;
import com.chatbridge.parser.ResponseParser;
import com.chatbridge.session.SessionStore;
import com.chatbridge.translate.InvocationDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Turns backend output lines into OpenAI {@code chat.completion.chunk} events.
 *
 * <p>Per response: one opening chunk with the assistant role, one chunk per piece of new text,
 * then a single terminal chunk with {@code finish_reason} and usage. The SSE form always ends with
 * {@code data: [DONE]}, also after a mid-stream failure, in which case no terminal chunk is sent.</p>
 *
 * <p>Backend lines pass through a queue of {@code channel-capacity} entries; the backend is only read
 * when the queue has room. If the backend stays silent for {@code idle-timeout-ms} while a line is
 * wanted, the response finishes with {@code length}. Time spent waiting on a slow client does not count.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamingPipeline {

    public static final String DONE_FRAME = "data: [DONE]\n\n";

    private final ResponseParser parser;
    private final SessionStore sessionStore;
    private final ObjectMapper mapper;
    private final BridgeProperties properties;
    private final Clock clock;

    public Flux<String> frames(InvocationDescriptor descriptor, Flux<String> backendLines) {
        return chunks(descriptor, backendLines)
                .map(this::toFrame)
                .onErrorResume(ex -> {
                    log.error("Dropping rest of stream requestId={}", descriptor.getRequestId(), ex);
                    return Flux.empty();
                })
                .concatWith(Mono.just(DONE_FRAME));
    }

    public Flux<StreamChunk> chunks(InvocationDescriptor descriptor, Flux<String> backendLines) {
        return Flux.defer(() -> {
            ParserState state = parser.newState(descriptor.getToolConfig(), descriptor.getPromptTokens());
            ChunkSequence sequence = new ChunkSequence(ChatCompletionResponse.newId(),
                    clock.instant().getEpochSecond(), descriptor.getModel());
            Duration idleTimeout = Duration.ofMillis(properties.getStreaming().getIdleTimeoutMs());
            int capacity = Math.max(1, properties.getStreaming().getChannelCapacity());

            Flux<StreamChunk> body = IdleTimeout.apply(backendLines, idleTimeout, Schedulers.parallel())
                    .publishOn(Schedulers.parallel(), capacity)
                    .onErrorResume(TimeoutException.class, ex -> {
                        log.warn("No backend output for {} ms requestId={}; finishing with length",
                                idleTimeout.toMillis(), descriptor.getRequestId());
                        state.markLength();
                        return Flux.empty();
                    })
                    .<StreamChunk>handle((line, sink) -> {
                        ParsedDelta delta = parser.parseIncremental(line, state);
                        if (delta.hasContent()) {
                            sink.next(sequence.content(delta.getContent()));
                        }
                    });

            Flux<StreamChunk> terminal = Flux.defer(() -> {
                ParsedDelta tail = parser.finish(state);
                ParsedResponse response = parser.summarize(state, false);
                List<StreamChunk> closing = new ArrayList<>();
                closing.add(sequence.terminal(response, tail.getContent()));
                recordSession(descriptor, parser.summarize(state, true));
                log.debug("Stream finished requestId={} id={} finishReason={} chunks={} skipped={}",
                        descriptor.getRequestId(), sequence.id(), response.getFinishReason(),
                        closing.get(0).getIndex() + 1, response.getSkippedChunks());
                return Flux.fromIterable(closing);
            });

            return Flux.concat(Mono.fromSupplier(sequence::start), body, terminal)
                    .onErrorResume(ex -> {
                        log.error("Streaming failed requestId={} id={}; closing stream without finish_reason",
                                descriptor.getRequestId(), sequence.id(), ex);
                        return Flux.empty();
                    })
                    .doOnCancel(() -> log.debug("Client cancelled stream requestId={} id={}",
                            descriptor.getRequestId(), sequence.id()));
        });
    }

    String toFrame(StreamChunk chunk) {
        try {
            return "data: " + mapper.writeValueAsString(chunk.toWire()) + "\n\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize stream chunk " + chunk.getIndex(), ex);
        }
    }

    private void recordSession(InvocationDescriptor descriptor, ParsedResponse response) {
        if (descriptor.getSessionId() == null) {
            return;
        }
        try {
            sessionStore.appendMessages(descriptor.getSessionId(), List.of(response.toAssistantMessage()));
        } catch (SessionNotFoundException ex) {
            log.warn("Session {} disappeared before the reply could be stored", descriptor.getSessionId());
        }
    }
}
