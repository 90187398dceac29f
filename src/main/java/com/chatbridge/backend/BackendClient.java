package com.chatbridge.backend;

import com.chatbridge.translate.InvocationDescriptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

public interface BackendClient {

    /**
     * Raw output lines in the order the backend produced them. Lines are only read on demand;
     * cancelling the subscription releases the backend invocation.
     */
    Flux<String> stream(InvocationDescriptor descriptor);

    default Mono<String> complete(InvocationDescriptor descriptor) {
        return stream(descriptor).collect(Collectors.joining("\n"));
    }
}
