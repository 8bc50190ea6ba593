package com.jreinhal.knowledge.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Step-by-step record of one request through the orchestrator.
 */
public class QueryTrace {
    private final String traceId;
    private final Instant startedAt;
    private final String sessionId;
    private final String userId;
    private final String callerId;
    private final List<QueryTraceStep> steps = new ArrayList<>();
    private final Map<String, Object> metrics = new LinkedHashMap<>();
    private long totalDurationMs;
    private boolean completed;
    private boolean success;
    private String outcome;

    public QueryTrace(String sessionId, String userId, String callerId) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.startedAt = Instant.now();
        this.sessionId = sessionId;
        this.userId = userId;
        this.callerId = callerId;
    }

    public synchronized void addStep(QueryTraceStep step) {
        this.steps.add(step);
        this.totalDurationMs += step.durationMs();
    }

    public synchronized void addMetric(String key, Object value) {
        this.metrics.put(key, value);
    }

    public synchronized void complete(boolean success, String outcome) {
        this.completed = true;
        this.success = success;
        this.outcome = outcome;
    }

    public String getTraceId() {
        return this.traceId;
    }

    public Instant getStartedAt() {
        return this.startedAt;
    }

    public String getSessionId() {
        return this.sessionId;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getCallerId() {
        return this.callerId;
    }

    public synchronized List<QueryTraceStep> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(this.steps));
    }

    public synchronized Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(this.metrics));
    }

    public synchronized long getTotalDurationMs() {
        return this.totalDurationMs;
    }

    public synchronized boolean isCompleted() {
        return this.completed;
    }

    public synchronized boolean isSuccess() {
        return this.success;
    }

    public synchronized String getOutcome() {
        return this.outcome;
    }

    public synchronized String getSummary() {
        return String.format("Trace[%s] session=%s steps=%d duration=%dms success=%s",
                this.traceId, this.sessionId, this.steps.size(), this.totalDurationMs, this.success);
    }
}
