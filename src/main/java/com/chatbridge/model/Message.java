package com.chatbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Message {
    Role role;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    String content;
    String name;
    List<ToolCall> toolCalls;
    String toolCallId;

    public static Message user(String content) {
        return Message.builder().role(Role.USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.ASSISTANT).content(content).build();
    }

    public static Message system(String content) {
        return Message.builder().role(Role.SYSTEM).content(content).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
