package com.chatbridge.translate;

import com.chatbridge.model.Message;
import com.chatbridge.tools.BackendToolConfig;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the backend needs for one call, already merged with session history.
 */
@Value
@Builder
public class InvocationDescriptor {
    String requestId;
    String model;
    String systemPrompt;
    String prompt;
    @Singular
    List<Message> messages;
    @Singular
    List<Message> incomingMessages;
    BackendToolConfig toolConfig;
    Integer maxTurns;
    String permissionMode;
    Integer maxThinkingTokens;
    boolean stream;
    String sessionId;
    int promptTokens;
    @Singular
    List<String> warnings;
}
