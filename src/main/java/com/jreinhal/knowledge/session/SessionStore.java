package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent, append-only session log. Events are only ever appended; the one structural
 * edit is delete followed by create.
 *
 * <p>Implementations throw {@link SessionStoreException} on backend failures.</p>
 */
public interface SessionStore {

    Optional<Session> get(SessionKey key);

    Session create(SessionKey key, Map<String, Object> initialState);

    void delete(SessionKey key);

    /**
     * Persists the event and appends it to {@code session}'s in-memory event list.
     */
    void appendEvent(Session session, Event event);

    /**
     * Persists one state entry and mirrors it into {@code session}'s state map.
     */
    void putState(Session session, String name, Object value);
}
