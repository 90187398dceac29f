package com.chatbridge.parser;

import com.chatbridge.model.FinishReason;
import com.chatbridge.model.Message;
import com.chatbridge.model.Role;
import com.chatbridge.model.ToolCall;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParsedResponse {
    String content;
    @Singular
    List<ToolCall> toolCalls;
    TokenUsage usage;
    FinishReason finishReason;
    @Singular
    List<String> warnings;
    int skippedChunks;

    public Message toAssistantMessage() {
        boolean hasCalls = !toolCalls.isEmpty();
        return Message.builder()
                .role(Role.ASSISTANT)
                .content(hasCalls && (content == null || content.isEmpty()) ? null : content)
                .toolCalls(hasCalls ? toolCalls : null)
                .build();
    }
}
