package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionStore sessionStore;

    public SessionManager(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * Loads the session, creating an empty one on first use. A concurrent creator winning the
     * insert race is resolved by reading its session back.
     */
    public Session getOrCreate(SessionKey key) {
        return this.sessionStore.get(key).orElseGet(() -> this.createOrReload(key));
    }

    private Session createOrReload(SessionKey key) {
        try {
            Session created = this.sessionStore.create(key, Map.of());
            log.info("Created session {}", key);
            return created;
        }
        catch (SessionStoreException e) {
            return this.sessionStore.get(key).orElseThrow(() -> e);
        }
    }
}
