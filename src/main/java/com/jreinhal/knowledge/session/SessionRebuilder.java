package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Replaces a session wholesale: delete, recreate under the same key with the given state,
 * then append the given events in order. Shared by compaction and corruption repair.
 */
@Component
public class SessionRebuilder {
    private static final Logger log = LoggerFactory.getLogger(SessionRebuilder.class);

    private final SessionStore sessionStore;

    public SessionRebuilder(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * A failure after the delete leaves a new session holding a prefix of {@code newEvents}.
     */
    public Session rebuildSession(SessionKey key, Map<String, Object> preserveState, List<Event> newEvents) {
        this.sessionStore.delete(key);
        Session rebuilt = this.sessionStore.create(key, preserveState);
        for (Event event : newEvents) {
            this.sessionStore.appendEvent(rebuilt, event);
        }
        log.debug("Rebuilt session {} with {} events and {} state keys", key, newEvents.size(),
                preserveState == null ? 0 : preserveState.size());
        return rebuilt;
    }
}
