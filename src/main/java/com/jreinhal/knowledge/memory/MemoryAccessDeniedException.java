package com.jreinhal.knowledge.memory;

/**
 * A memory write refused by the permission policy. The message is meant for the end user.
 */
public class MemoryAccessDeniedException extends RuntimeException {
    private final String operation;
    private final String reason;

    public MemoryAccessDeniedException(String operation, String reason) {
        super("Insufficient permissions to " + operation + " memory: " + reason);
        this.operation = operation;
        this.reason = reason;
    }

    public String getOperation() {
        return this.operation;
    }

    public String getReason() {
        return this.reason;
    }
}
