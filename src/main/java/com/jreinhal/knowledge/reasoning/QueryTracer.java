package com.jreinhal.knowledge.reasoning;

import com.github.benmanes.caffeine.cache.Cache;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class QueryTracer {
    private static final Logger log = LoggerFactory.getLogger(QueryTracer.class);

    private final Cache<String, QueryTrace> traceCache;
    private final boolean enabled;

    public QueryTracer(Cache<String, QueryTrace> queryTraceCache,
                       @Value("${knowledge.trace.enabled:true}") boolean enabled) {
        this.traceCache = queryTraceCache;
        this.enabled = enabled;
    }

    public QueryTrace startTrace(String sessionId, String userId, String callerId) {
        QueryTrace trace = new QueryTrace(sessionId, userId, callerId);
        log.debug("Started trace {} for session {}", trace.getTraceId(), sessionId);
        return trace;
    }

    public void addStep(QueryTrace trace, QueryTraceStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(trace, type, label, detail, durationMs, Map.of());
    }

    public void addStep(QueryTrace trace, QueryTraceStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        if (trace == null || !this.enabled) {
            return;
        }
        trace.addStep(new QueryTraceStep(type, label, detail, durationMs, data));
    }

    /**
     * Runs {@code operation} and records it as a step, or as an ERROR step when it throws.
     */
    public <T> T timed(QueryTrace trace, QueryTraceStep.StepType type, String label, Supplier<T> operation) {
        long start = System.currentTimeMillis();
        T result;
        try {
            result = operation.get();
        }
        catch (RuntimeException e) {
            this.addStep(trace, QueryTraceStep.StepType.ERROR, label + " (failed)", e.getMessage(), System.currentTimeMillis() - start);
            throw e;
        }
        this.addStep(trace, type, label, null, System.currentTimeMillis() - start);
        return result;
    }

    public void endTrace(QueryTrace trace, boolean success, String outcome) {
        if (trace == null) {
            return;
        }
        trace.complete(success, outcome);
        if (this.enabled) {
            this.traceCache.put(trace.getTraceId(), trace);
        }
        log.debug("Completed {}", trace.getSummary());
    }

    public Optional<QueryTrace> getTrace(String traceId) {
        return Optional.ofNullable(this.traceCache.getIfPresent(traceId));
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
