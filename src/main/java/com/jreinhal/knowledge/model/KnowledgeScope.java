package com.jreinhal.knowledge.model;

import java.util.Locale;

/**
 * Which identity dimension partitions sessions and memories.
 */
public enum KnowledgeScope {
    SHARED,
    CHANNEL,
    USER;

    /**
     * Returns {@code null} for unrecognized values; callers treat that as shared.
     */
    public static KnowledgeScope fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return KnowledgeScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            return null;
        }
    }
}
