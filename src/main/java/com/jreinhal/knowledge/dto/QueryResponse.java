package com.jreinhal.knowledge.dto;

public record QueryResponse(boolean success, String answer, String message, String sessionId, String traceId) {

    public static QueryResponse ok(String answer, String sessionId, String traceId) {
        return new QueryResponse(true, answer, null, sessionId, traceId);
    }

    public static QueryResponse failed(String message, String sessionId, String traceId) {
        return new QueryResponse(false, null, message, sessionId, traceId);
    }
}
