package com.chatbridge.session;

import com.chatbridge.model.Message;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One conversation. Messages are append-only; every read or write through the store
 * moves {@code lastAccessed} forward and re-bases the expiry.
 */
public class Session {

    @Getter
    private final String id;
    @Getter
    private final Instant createdAt;
    @Getter
    private final String model;
    @Getter
    private final String systemPrompt;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Message> messages = new ArrayList<>();
    private final Duration ttl;

    private volatile Instant lastAccessed;
    private volatile Instant expiresAt;
    private volatile SessionStatus status = SessionStatus.ACTIVE;
    private volatile Integer maxTurns;

    Session(String id, String model, String systemPrompt, Instant now, Duration ttl) {
        this.id = id;
        this.model = model;
        this.systemPrompt = systemPrompt;
        this.createdAt = now;
        this.ttl = ttl;
        this.lastAccessed = now;
        this.expiresAt = now.plus(ttl);
    }

    public List<Message> getMessages() {
        lock.lock();
        try {
            return List.copyOf(messages);
        } finally {
            lock.unlock();
        }
    }

    public int getMessageCount() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastAccessed() {
        return lastAccessed;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public Integer getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(Integer maxTurns) {
        this.maxTurns = maxTurns;
    }

    public boolean isExpired(Instant now) {
        return status != SessionStatus.ACTIVE || now.isAfter(expiresAt);
    }

    public SessionSummary summary() {
        lock.lock();
        try {
            return new SessionSummary(id, createdAt, lastAccessed, expiresAt, messages.size(), model, status);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false when the session is already closed or past its expiry
     */
    boolean touch(Instant now) {
        lock.lock();
        try {
            if (status != SessionStatus.ACTIVE || now.isAfter(expiresAt)) {
                return false;
            }
            refresh(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the session if it is past its expiry at {@code now}. Returns true when the session
     * is closed afterwards, whether by this call or earlier.
     */
    boolean expireIfDue(Instant now) {
        lock.lock();
        try {
            if (status == SessionStatus.ACTIVE) {
                if (!now.isAfter(expiresAt)) {
                    return false;
                }
                status = SessionStatus.EXPIRED;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean append(List<Message> incoming, Instant now) {
        lock.lock();
        try {
            if (status != SessionStatus.ACTIVE || now.isAfter(expiresAt)) {
                return false;
            }
            messages.addAll(incoming);
            refresh(now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    void close(SessionStatus finalStatus) {
        lock.lock();
        try {
            status = finalStatus;
        } finally {
            lock.unlock();
        }
    }

    private void refresh(Instant now) {
        if (now.isAfter(lastAccessed)) {
            lastAccessed = now;
            expiresAt = now.plus(ttl);
        }
    }
}
