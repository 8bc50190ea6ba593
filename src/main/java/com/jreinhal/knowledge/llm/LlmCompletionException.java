package com.jreinhal.knowledge.llm;

public class LlmCompletionException extends RuntimeException {
    public LlmCompletionException(String message) {
        super(message);
    }

    public LlmCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
