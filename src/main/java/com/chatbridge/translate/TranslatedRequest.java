package com.chatbridge.translate;

import com.chatbridge.session.Session;
import lombok.Value;

import java.util.Optional;

@Value
public class TranslatedRequest {
    InvocationDescriptor descriptor;
    Session session;

    public Optional<Session> sessionIfAny() {
        return Optional.ofNullable(session);
    }
}
