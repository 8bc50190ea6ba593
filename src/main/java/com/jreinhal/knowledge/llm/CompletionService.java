package com.jreinhal.knowledge.llm;

import java.time.Duration;

/**
 * Single-shot text completion used for summaries and response cleanup.
 */
public interface CompletionService {

    /**
     * @throws LlmCompletionException on backend failure, timeout or an open circuit
     */
    CompletionResult complete(String systemPrompt, String userPrompt, Duration timeout);
}
