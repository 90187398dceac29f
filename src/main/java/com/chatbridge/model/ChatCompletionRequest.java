package com.chatbridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatCompletionRequest {
    private String model;
    private List<ChatMessage> messages;
    private Boolean stream;
    private String sessionId;
    private List<JsonNode> tools;
    private JsonNode toolChoice;

    // accepted for compatibility, not forwarded to the backend
    private Double temperature;
    private Double topP;
    private Integer n;
    private JsonNode stop;
    private Integer maxTokens;
    private Double presencePenalty;
    private Double frequencyPenalty;
    private Map<String, Object> logitBias;
    private String user;

    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }
}
