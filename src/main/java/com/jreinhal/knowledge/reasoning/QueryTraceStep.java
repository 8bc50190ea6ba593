package com.jreinhal.knowledge.reasoning;

import java.util.Map;

public record QueryTraceStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public QueryTraceStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static QueryTraceStep of(StepType type, String label, String detail, long durationMs) {
        return new QueryTraceStep(type, label, detail, durationMs, Map.of());
    }

    public enum StepType {
        IDENTITY,
        SESSION,
        THREAD_SYNC,
        CONTEXT_SUMMARY,
        COMPACTION,
        PRE_SEARCH,
        AGENT_RUN,
        SESSION_REPAIR,
        RESPONSE_CLEANUP,
        ERROR
    }
}
