package com.jreinhal.knowledge.security;

import com.jreinhal.knowledge.model.CallerIdentity;

/**
 * Request-scoped caller identity for the memory-write path.
 *
 * <p>Callers should pass the identity explicitly. The thread binding covers code on the request
 * thread. The last-seen value covers tool callbacks the agent framework dispatches on other
 * threads; it is best effort only, since concurrent requests overwrite it, and it is consulted
 * only when neither of the other two is present. Request entry points never use it.</p>
 */
public final class CallerContext {
    private static final ThreadLocal<CallerIdentity> current = new ThreadLocal<>();
    private static final Object lastSeenLock = new Object();
    private static CallerIdentity lastSeen;

    private CallerContext() {
    }

    public static void bind(CallerIdentity identity) {
        if (identity == null) {
            current.remove();
            return;
        }
        current.set(identity);
        if (!identity.isEmpty()) {
            synchronized (lastSeenLock) {
                lastSeen = identity;
            }
        }
    }

    public static CallerIdentity current() {
        return current.get();
    }

    public static CallerIdentity lastSeen() {
        synchronized (lastSeenLock) {
            return lastSeen;
        }
    }

    /**
     * Explicit value first, then the thread binding. The last-seen fallback is consulted only when
     * both are absent, that is when a framework callback lost the identity entirely.
     */
    public static CallerIdentity resolve(CallerIdentity explicit) {
        if (explicit != null) {
            return explicit;
        }
        CallerIdentity bound = current.get();
        if (bound != null) {
            return bound;
        }
        CallerIdentity fallback = lastSeen();
        return fallback != null ? fallback : CallerIdentity.anonymous();
    }

    public static void clear() {
        current.remove();
    }

    static void resetLastSeen() {
        synchronized (lastSeenLock) {
            lastSeen = null;
        }
    }
}
