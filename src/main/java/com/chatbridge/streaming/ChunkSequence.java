package com.chatbridge.streaming;

import com.chatbridge.model.Role;
import com.chatbridge.parser.ParsedResponse;

class ChunkSequence {

    private final String id;
    private final long created;
    private final String model;
    private int next;

    ChunkSequence(String id, long created, String model) {
        this.id = id;
        this.created = created;
        this.model = model;
    }

    StreamChunk start() {
        return new StreamChunk(id, created, model, next++, Role.ASSISTANT, "", null, null, null);
    }

    StreamChunk content(String text) {
        return new StreamChunk(id, created, model, next++, null, text, null, null, null);
    }

    StreamChunk terminal(ParsedResponse response, String tail) {
        return new StreamChunk(id, created, model, next++, null, tail == null || tail.isEmpty() ? null : tail,
                response.getToolCalls().isEmpty() ? null : response.getToolCalls(),
                response.getFinishReason(), response.getUsage().toWire());
    }

    String id() {
        return id;
    }
}
