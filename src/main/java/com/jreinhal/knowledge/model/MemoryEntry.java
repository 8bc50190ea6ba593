package com.jreinhal.knowledge.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public record MemoryEntry(String id, String userId, String content, Map<String, Object> metadata,
                          double score, Instant createdAt, Instant updatedAt) {

    public MemoryEntry {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }
}
