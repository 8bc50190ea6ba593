package com.jreinhal.knowledge.agent;

import com.jreinhal.knowledge.memory.MemoryAccessDeniedException;
import com.jreinhal.knowledge.memory.MemoryOperationException;
import com.jreinhal.knowledge.memory.PermissionGatedMemoryStore;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.MemoryEntry;
import com.jreinhal.knowledge.session.SessionIdentityResolver;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * Memory tools exposed to the model. The caller identity arrives through the tool context of
 * the run; writes go through {@link PermissionGatedMemoryStore}.
 */
@Component
public class MemoryTools {
    private static final Logger log = LoggerFactory.getLogger(MemoryTools.class);
    static final String DENIED_PREFIX = "⛔ ";
    private static final int SEARCH_LIMIT = 10;

    private final PermissionGatedMemoryStore memoryStore;

    public MemoryTools(PermissionGatedMemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Tool(name = "search_memory", description = "Search the knowledge base. Each result has an id usable with update_memory and delete_memory.")
    public String searchMemory(@ToolParam(description = "Specific, descriptive search query") String query, ToolContext toolContext) {
        try {
            List<MemoryEntry> results = this.memoryStore.search(memoryUserId(toolContext), query, SEARCH_LIMIT);
            if (results.isEmpty()) {
                return "No relevant memories found.";
            }
            StringBuilder sb = new StringBuilder();
            for (MemoryEntry entry : results) {
                sb.append("- id=").append(entry.id())
                        .append(" score=").append(String.format(Locale.ROOT, "%.2f", entry.score()))
                        .append(": ").append(entry.content()).append('\n');
            }
            return sb.toString();
        }
        catch (RuntimeException e) {
            log.warn("search_memory failed: {}", e.getMessage());
            return "Error: memory search failed: " + e.getMessage();
        }
    }

    @Tool(name = "save_to_memory", description = "Store important information for future retrieval. Include context and dates.")
    public String saveToMemory(@ToolParam(description = "Self-contained text of the memory") String content, ToolContext toolContext) {
        try {
            MemoryEntry saved = this.memoryStore.add(caller(toolContext), memoryUserId(toolContext), content,
                    Map.of("source", "agent", "savedAt", Instant.now().toString()));
            log(toolContext).recordWrite(true);
            return "Saved to memory with id " + saved.id();
        }
        catch (MemoryAccessDeniedException e) {
            return this.denied(toolContext, e);
        }
        catch (MemoryOperationException e) {
            log(toolContext).recordWrite(false);
            return "Error: " + e.getMessage();
        }
    }

    @Tool(name = "update_memory", description = "Replace the content of an existing memory entry. Use search_memory first to get the id.")
    public String updateMemory(@ToolParam(description = "Memory id from search_memory") String id,
                               @ToolParam(description = "New full content") String content, ToolContext toolContext) {
        try {
            this.memoryStore.update(caller(toolContext), memoryUserId(toolContext), id, content);
            log(toolContext).recordWrite(true);
            return "Updated memory " + id;
        }
        catch (MemoryAccessDeniedException e) {
            return this.denied(toolContext, e);
        }
        catch (MemoryOperationException e) {
            log(toolContext).recordWrite(false);
            return "Error: " + e.getMessage();
        }
    }

    @Tool(name = "delete_memory", description = "Delete a memory entry permanently. Use search_memory first to get the id.")
    public String deleteMemory(@ToolParam(description = "Memory id from search_memory") String id, ToolContext toolContext) {
        try {
            this.memoryStore.delete(caller(toolContext), memoryUserId(toolContext), id);
            log(toolContext).recordWrite(true);
            return "Deleted memory " + id;
        }
        catch (MemoryAccessDeniedException e) {
            return this.denied(toolContext, e);
        }
        catch (MemoryOperationException e) {
            log(toolContext).recordWrite(false);
            return "Error: " + e.getMessage();
        }
    }

    private String denied(ToolContext toolContext, MemoryAccessDeniedException e) {
        String message = DENIED_PREFIX + e.getMessage();
        log(toolContext).recordDenied(message);
        return message + ". Tell the user they do not have permission; do not claim the operation succeeded.";
    }

    /**
     * {@code null} when the framework dropped the context; the gated store then falls back.
     */
    static CallerIdentity caller(ToolContext toolContext) {
        Object value = contextValue(toolContext, ToolContextKeys.CALLER);
        return value instanceof CallerIdentity identity ? identity : null;
    }

    static String memoryUserId(ToolContext toolContext) {
        Object value = contextValue(toolContext, ToolContextKeys.MEMORY_USER_ID);
        return value instanceof String userId && !userId.isBlank() ? userId : SessionIdentityResolver.SHARED_PARTITION;
    }

    static ToolInvocationLog log(ToolContext toolContext) {
        Object value = contextValue(toolContext, ToolContextKeys.TOOL_LOG);
        return value instanceof ToolInvocationLog toolLog ? toolLog : new ToolInvocationLog();
    }

    static Object contextValue(ToolContext toolContext, String key) {
        if (toolContext == null || toolContext.getContext() == null) {
            return null;
        }
        return toolContext.getContext().get(key);
    }
}
