package com.chatbridge.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SessionSweeper {

    private final SessionStore sessionStore;

    @Scheduled(initialDelayString = "${bridge.session.cleanup-interval-ms:300000}",
            fixedDelayString = "${bridge.session.cleanup-interval-ms:300000}")
    public void sweepExpired() {
        try {
            int removed = sessionStore.sweep();
            log.debug("Scheduled session sweep completed removed={}", removed);
        } catch (RuntimeException ex) {
            log.error("Scheduled session sweep failed", ex);
        }
    }
}
