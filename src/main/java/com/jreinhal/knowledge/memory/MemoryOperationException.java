package com.jreinhal.knowledge.memory;

public class MemoryOperationException extends RuntimeException {
    private final String operation;

    public MemoryOperationException(String operation, Throwable cause) {
        super(operation + " memory failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return this.operation;
    }
}
