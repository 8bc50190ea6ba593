package com.jreinhal.knowledge.task;

public class SubAgentException extends RuntimeException {
    public SubAgentException(String message) {
        super(message);
    }

    public SubAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
