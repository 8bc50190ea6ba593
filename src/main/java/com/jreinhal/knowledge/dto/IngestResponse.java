package com.jreinhal.knowledge.dto;

public record IngestResponse(boolean success, String message, int memoriesAdded, String sessionId) {
}
