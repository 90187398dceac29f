package com.chatbridge.session;

import lombok.Value;

@Value
public class SessionStats {
    int active;
    int expired;
    long totalMessages;
}
