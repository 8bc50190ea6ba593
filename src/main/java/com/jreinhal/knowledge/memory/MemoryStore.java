package com.jreinhal.knowledge.memory;

import com.jreinhal.knowledge.model.MemoryEntry;
import java.util.List;
import java.util.Map;

/**
 * Long-term memory partitioned by user scope. Implementations throw
 * {@link MemoryStoreException} on backend failures and unknown ids.
 */
public interface MemoryStore {

    MemoryEntry add(String userId, String content, Map<String, Object> metadata);

    List<MemoryEntry> search(String userId, String query, int topK);

    MemoryEntry update(String userId, String id, String content);

    void delete(String userId, String id);
}
