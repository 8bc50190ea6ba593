package com.jreinhal.knowledge.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "agent_sessions")
public class Session {
    public static final String STATE_LAST_SYNCED_TS = "last_synced_ts";

    @Id
    private String id;
    private String appName;
    private String userId;
    private String sessionId;
    private List<Event> events = new ArrayList<>();
    private Map<String, Object> state = new HashMap<>();
    private Instant createdAt;
    @Indexed
    private Instant lastUpdatedAt;

    public Session() {
    }

    public static Session create(SessionKey key, Map<String, Object> initialState, Instant now) {
        Session session = new Session();
        session.setId(key.documentId());
        session.setAppName(key.appName());
        session.setUserId(key.userId());
        session.setSessionId(key.sessionId());
        session.setState(initialState == null ? new HashMap<>() : new HashMap<>(initialState));
        session.setCreatedAt(now);
        session.setLastUpdatedAt(now);
        return session;
    }

    public SessionKey key() {
        return new SessionKey(this.appName, this.userId, this.sessionId);
    }

    public String stateString(String name) {
        Object value = this.state == null ? null : this.state.get(name);
        return value == null ? "" : value.toString();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAppName() {
        return this.appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public String getUserId() {
        return this.userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getSessionId() {
        return this.sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public List<Event> getEvents() {
        return this.events;
    }

    public void setEvents(List<Event> events) {
        this.events = events == null ? new ArrayList<>() : events;
    }

    public Map<String, Object> getState() {
        return this.state;
    }

    public void setState(Map<String, Object> state) {
        this.state = state == null ? new HashMap<>() : state;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastUpdatedAt() {
        return this.lastUpdatedAt;
    }

    public void setLastUpdatedAt(Instant lastUpdatedAt) {
        this.lastUpdatedAt = lastUpdatedAt;
    }
}
