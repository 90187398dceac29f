package com.chatbridge.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionSummary {
    String sessionId;
    Instant createdAt;
    Instant lastAccessed;
    Instant expiresAt;
    int messageCount;
    String model;
    SessionStatus status;
}
