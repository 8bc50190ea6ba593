package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MongoSessionStore implements SessionStore {
    private static final Logger log = LoggerFactory.getLogger(MongoSessionStore.class);
    static final String COLLECTION = "agent_sessions";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final long ttlHours;

    public MongoSessionStore(MongoTemplate mongoTemplate, Clock clock,
                             @Value("${knowledge.session.ttl-hours:24}") long ttlHours) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.ttlHours = ttlHours;
    }

    @Override
    public Optional<Session> get(SessionKey key) {
        try {
            return Optional.ofNullable(this.mongoTemplate.findById(key.documentId(), Session.class, COLLECTION));
        }
        catch (DataAccessException e) {
            throw new SessionStoreException("Failed to load session " + key, e);
        }
    }

    @Override
    public Session create(SessionKey key, Map<String, Object> initialState) {
        Session session = Session.create(key, initialState, this.clock.instant());
        try {
            this.mongoTemplate.insert(session, COLLECTION);
        }
        catch (DuplicateKeyException e) {
            throw new SessionStoreException("Session already exists: " + key, e);
        }
        catch (DataAccessException e) {
            throw new SessionStoreException("Failed to create session " + key, e);
        }
        log.debug("Created session {}", key);
        return session;
    }

    @Override
    public void delete(SessionKey key) {
        try {
            DeleteResult result = this.mongoTemplate.remove(byId(key.documentId()), COLLECTION);
            log.debug("Deleted session {} (removed={})", key, result.getDeletedCount());
        }
        catch (DataAccessException e) {
            throw new SessionStoreException("Failed to delete session " + key, e);
        }
    }

    @Override
    public void appendEvent(Session session, Event event) {
        Instant now = this.clock.instant();
        Update update = new Update().push("events", event).set("lastUpdatedAt", now);
        UpdateResult result = this.update(session, update, "append event");
        if (result.getMatchedCount() == 0L) {
            throw new SessionStoreException("Session not found for append: " + session.key());
        }
        session.getEvents().add(event);
        session.setLastUpdatedAt(now);
    }

    @Override
    public void putState(Session session, String name, Object value) {
        Instant now = this.clock.instant();
        Update update = new Update().set("state." + name, value).set("lastUpdatedAt", now);
        UpdateResult result = this.update(session, update, "update state");
        if (result.getMatchedCount() == 0L) {
            throw new SessionStoreException("Session not found for state update: " + session.key());
        }
        session.getState().put(name, value);
        session.setLastUpdatedAt(now);
    }

    @Scheduled(fixedRateString = "${knowledge.session.purge-interval-ms:3600000}")
    public void purgeIdleSessions() {
        if (this.ttlHours <= 0L) {
            return;
        }
        Instant cutoff = this.clock.instant().minusSeconds(this.ttlHours * 3600L);
        try {
            DeleteResult result = this.mongoTemplate.remove(new Query(Criteria.where("lastUpdatedAt").lt(cutoff)), COLLECTION);
            if (result.getDeletedCount() > 0L) {
                log.info("Purged {} sessions idle since before {}", result.getDeletedCount(), cutoff);
            }
        }
        catch (DataAccessException e) {
            log.warn("Session purge failed: {}", e.getMessage());
        }
    }

    private UpdateResult update(Session session, Update update, String operation) {
        try {
            return this.mongoTemplate.updateFirst(byId(session.getId()), update, COLLECTION);
        }
        catch (DataAccessException e) {
            throw new SessionStoreException("Failed to " + operation + " for session " + session.key(), e);
        }
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
