package com.chatbridge.streaming;

import com.chatbridge.model.ChatCompletionChunk;
import com.chatbridge.model.FinishReason;
import com.chatbridge.model.Role;
import com.chatbridge.model.ToolCall;
import com.chatbridge.model.Usage;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One event of a streamed completion. {@code index} orders events inside the server; the wire body
 * always carries a single choice with index 0.
 */
@Value
public class StreamChunk {
    String id;
    long created;
    String model;
    int index;
    Role role;
    String content;
    List<ToolCall> toolCalls;
    FinishReason finishReason;
    Usage usage;

    public boolean isTerminal() {
        return finishReason != null;
    }

    public ChatCompletionChunk toWire() {
        List<ChatCompletionChunk.ToolCallDelta> deltas = null;
        if (toolCalls != null && !toolCalls.isEmpty()) {
            deltas = new ArrayList<>();
            for (int i = 0; i < toolCalls.size(); i++) {
                ToolCall call = toolCalls.get(i);
                deltas.add(ChatCompletionChunk.ToolCallDelta.builder()
                        .index(i)
                        .id(call.getId())
                        .type(call.getType())
                        .function(call.getFunction())
                        .build());
            }
        }
        ChatCompletionChunk.Delta delta = ChatCompletionChunk.Delta.builder()
                .role(role)
                .content(content)
                .toolCalls(deltas)
                .build();
        return ChatCompletionChunk.builder()
                .id(id)
                .created(created)
                .model(model)
                .choices(List.of(ChatCompletionChunk.Choice.builder().index(0).delta(delta).finishReason(finishReason).build()))
                .usage(usage)
                .build();
    }
}
