package com.jreinhal.knowledge.llm;

public record CompletionResult(String text, int promptTokens, int completionTokens) {

    public boolean isBlank() {
        return this.text == null || this.text.isBlank();
    }
}
