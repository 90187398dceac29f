package com.chatbridge.session;

import com.chatbridge.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Process-lifetime store of conversation sessions with a sliding TTL.
 * Every operation may be called concurrently for the same or different ids.
 */
public interface SessionStore {

    /**
     * Returns the live session and refreshes its expiry; expired sessions are reported as absent.
     */
    Optional<Session> get(String id);

    Session create(String id, String model, String systemPrompt);

    /**
     * @throws com.chatbridge.exception.SessionNotFoundException when the id is unknown or expired
     */
    void appendMessages(String id, List<Message> messages);

    boolean delete(String id);

    List<SessionSummary> list();

    SessionStats stats();

    /**
     * Removes every session whose expiry has passed.
     *
     * @return number of sessions removed by this call
     */
    int sweep();
}
