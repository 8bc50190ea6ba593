package com.jreinhal.knowledge.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One immutable entry in a session's event log.
 */
public record Event(String id, String role, List<String> parts, String author, Instant timestamp) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";

    public Event {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static Event user(String author, String text) {
        return of(ROLE_USER, author, text);
    }

    public static Event model(String author, String text) {
        return of(ROLE_MODEL, author, text);
    }

    public static Event of(String role, String author, String text) {
        return new Event(UUID.randomUUID().toString(), role, List.of(text == null ? "" : text), author, Instant.now());
    }

    public String text() {
        return String.join("\n", this.parts);
    }

    public boolean isUser() {
        return ROLE_USER.equals(this.role);
    }
}
