package com.jreinhal.knowledge.agent;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-request record of memory tool outcomes, so denied writes reach the user even when the
 * model glosses over them.
 */
public class ToolInvocationLog {
    private final List<String> deniedReasons = new ArrayList<>();
    private int successfulWrites;
    private int failedWrites;

    public synchronized void recordDenied(String message) {
        this.deniedReasons.add(message);
    }

    public synchronized void recordWrite(boolean success) {
        if (success) {
            this.successfulWrites++;
        }
        else {
            this.failedWrites++;
        }
    }

    public synchronized List<String> deniedReasons() {
        return List.copyOf(this.deniedReasons);
    }

    public synchronized boolean hasDenials() {
        return !this.deniedReasons.isEmpty();
    }

    public synchronized int successfulWrites() {
        return this.successfulWrites;
    }

    public synchronized int failedWrites() {
        return this.failedWrites;
    }
}
