package com.jreinhal.knowledge.model;

import java.util.List;

/**
 * A message from the chat thread attached to a request, oldest first.
 */
public record TranscriptMessage(String user, String userName, String text, String ts, List<String> images) {
    public static final String BOT_PREFIX = "bot:";

    public TranscriptMessage {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public TranscriptMessage(String user, String text, String ts) {
        this(user, null, text, ts, List.of());
    }

    public String displayName() {
        if (this.userName != null && !this.userName.isBlank()) {
            return this.userName;
        }
        if (this.user != null && !this.user.isBlank()) {
            return this.user;
        }
        return "Unknown";
    }

    public boolean fromBot() {
        return this.displayName().startsWith(BOT_PREFIX);
    }
}
