package com.jreinhal.knowledge.memory;

import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.MemoryEntry;
import com.jreinhal.knowledge.security.CallerContext;
import com.jreinhal.knowledge.security.MemoryPermissionChecker;
import com.jreinhal.knowledge.security.PermissionDecision;
import com.jreinhal.knowledge.util.LogSanitizer;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Memory access for the agent. Searches pass straight through; every write is checked against
 * {@link MemoryPermissionChecker} for the caller passed in, falling back to {@link CallerContext}
 * when none is given.
 */
@Service
public class PermissionGatedMemoryStore {
    private static final Logger log = LoggerFactory.getLogger(PermissionGatedMemoryStore.class);

    private final MemoryStore delegate;
    private final MemoryPermissionChecker permissionChecker;

    public PermissionGatedMemoryStore(MemoryStore delegate, MemoryPermissionChecker permissionChecker) {
        this.delegate = delegate;
        this.permissionChecker = permissionChecker;
    }

    public List<MemoryEntry> search(String userId, String query, int topK) {
        return this.delegate.search(userId, query, topK);
    }

    /**
     * @throws MemoryAccessDeniedException when the caller may not write
     * @throws MemoryOperationException when the underlying store fails
     */
    public MemoryEntry add(CallerIdentity caller, String userId, String content, Map<String, Object> metadata) {
        this.authorize("save", caller);
        return this.forward("save", () -> this.delegate.add(userId, content, metadata));
    }

    public MemoryEntry update(CallerIdentity caller, String userId, String id, String content) {
        this.authorize("update", caller);
        return this.forward("update", () -> this.delegate.update(userId, id, content));
    }

    public void delete(CallerIdentity caller, String userId, String id) {
        this.authorize("delete", caller);
        this.forward("delete", () -> {
            this.delegate.delete(userId, id);
            return null;
        });
    }

    private void authorize(String operation, CallerIdentity explicit) {
        CallerIdentity caller = CallerContext.resolve(explicit);
        PermissionDecision decision = this.permissionChecker.canWrite(caller);
        if (decision.allowed()) {
            log.info("Memory {} allowed for caller {}: {}", operation, LogSanitizer.sanitize(caller.displayId()), decision.reason());
            return;
        }
        log.warn("Memory {} denied for caller {}: {}", operation, LogSanitizer.sanitize(caller.displayId()), decision.reason());
        throw new MemoryAccessDeniedException(operation, decision.reason());
    }

    private <T> T forward(String operation, Supplier<T> call) {
        try {
            return call.get();
        }
        catch (MemoryStoreException | IllegalArgumentException e) {
            throw new MemoryOperationException(operation, e);
        }
        catch (RuntimeException e) {
            log.error("Memory {} failed unexpectedly", operation, e);
            throw new MemoryOperationException(operation, e);
        }
    }
}
