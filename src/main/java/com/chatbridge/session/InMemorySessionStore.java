package com.chatbridge.session;

import com.chatbridge.config.BridgeProperties;
import com.chatbridge.exception.SessionNotFoundException;
import com.chatbridge.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sessions live in a concurrent map; each session guards its own history.
 * {@code indexLock} only serializes the bookkeeping that must see a consistent key set:
 * capacity checks with eviction on create, and the expiry sweep.
 */
@Service
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock indexLock = new ReentrantLock();

    private final Clock clock;
    private final Duration ttl;
    private final int maxSessions;

    @Autowired
    public InMemorySessionStore(BridgeProperties properties, Clock clock) {
        this(clock, Duration.ofMinutes(properties.getSession().getTtlMinutes()), properties.getSession().getMaxSessions());
    }

    InMemorySessionStore(Clock clock, Duration ttl, int maxSessions) {
        this.clock = clock;
        this.ttl = ttl;
        this.maxSessions = Math.max(1, maxSessions);
    }

    @Override
    public Optional<Session> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Session session = sessions.get(id);
        if (session == null) {
            log.debug("Session lookup sessionId={} -> missing", id);
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (!session.touch(now)) {
            expire(session, now);
            log.debug("Session lookup sessionId={} -> expired", id);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    public Session create(String id, String model, String systemPrompt) {
        String sessionId = StringUtils.hasText(id) ? id : UUID.randomUUID().toString();
        indexLock.lock();
        try {
            Instant now = clock.instant();
            Session existing = sessions.get(sessionId);
            if (existing != null) {
                if (existing.touch(now)) {
                    return existing;
                }
                expire(existing, now);
            }
            while (sessions.size() >= maxSessions) {
                evictLeastRecentlyUsed();
            }
            Session session = new Session(sessionId, model, systemPrompt, now, ttl);
            sessions.put(sessionId, session);
            log.debug("Created session sessionId={} model={} total={}", sessionId, model, sessions.size());
            return session;
        } finally {
            indexLock.unlock();
        }
    }

    @Override
    public void appendMessages(String id, List<Message> messages) {
        Session session = id == null ? null : sessions.get(id);
        Instant now = clock.instant();
        if (session == null || !session.append(messages, now)) {
            throw new SessionNotFoundException(id);
        }
        log.debug("Appended {} message(s) sessionId={} -> total={}", messages.size(), id, session.getMessageCount());
    }

    @Override
    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        Session removed = sessions.remove(id);
        if (removed == null) {
            log.debug("No session found to delete sessionId={}", id);
            return false;
        }
        removed.close(SessionStatus.DELETED);
        log.debug("Deleted session sessionId={} removedMessages={}", id, removed.getMessageCount());
        return true;
    }

    @Override
    public List<SessionSummary> list() {
        Instant now = clock.instant();
        return sessions.values().stream()
                .filter(session -> !session.isExpired(now))
                .map(Session::summary)
                .sorted(Comparator.comparing(SessionSummary::getCreatedAt))
                .toList();
    }

    @Override
    public SessionStats stats() {
        Instant now = clock.instant();
        int active = 0;
        int expired = 0;
        long totalMessages = 0;
        for (Session session : sessions.values()) {
            if (session.isExpired(now)) {
                expired++;
            } else {
                active++;
            }
            totalMessages += session.getMessageCount();
        }
        return new SessionStats(active, expired, totalMessages);
    }

    @Override
    public int sweep() {
        indexLock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            for (Session session : sessions.values()) {
                if (expire(session, now)) {
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Session sweep removed {} expired session(s); remaining={}", removed, sessions.size());
            } else {
                log.trace("Session sweep found nothing to remove; remaining={}", sessions.size());
            }
            return removed;
        } finally {
            indexLock.unlock();
        }
    }

    // The session lock decides between a concurrent touch and expiry; only a closed session leaves the index.
    private boolean expire(Session session, Instant now) {
        return session.expireIfDue(now) && sessions.remove(session.getId(), session);
    }

    private void evictLeastRecentlyUsed() {
        sessions.values().stream()
                .min(Comparator.comparing(Session::getLastAccessed))
                .ifPresent(victim -> {
                    victim.close(SessionStatus.EXPIRED);
                    if (sessions.remove(victim.getId(), victim)) {
                        log.info("Evicted least recently used session sessionId={} lastAccessed={}",
                                victim.getId(), victim.getLastAccessed());
                    }
                });
    }
}
