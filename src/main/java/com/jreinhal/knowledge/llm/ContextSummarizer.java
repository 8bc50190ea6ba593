package com.jreinhal.knowledge.llm;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Compresses an oversized request transcript before it goes into the instruction.
 * Works on the attached transcript only; persisted sessions are handled by compaction.
 */
@Service
public class ContextSummarizer {
    private static final Logger log = LoggerFactory.getLogger(ContextSummarizer.class);

    private final CompletionService completionService;
    private final boolean enabled;
    private final int tokenThreshold;
    private final Duration timeout;

    public ContextSummarizer(CompletionService completionService,
                             @Value("${knowledge.context-summarizer.enabled:false}") boolean enabled,
                             @Value("${knowledge.context-summarizer.token-threshold:8000}") int tokenThreshold,
                             @Value("${knowledge.session.summarize-timeout-seconds:60}") long timeoutSeconds) {
        this.completionService = completionService;
        this.enabled = enabled;
        this.tokenThreshold = tokenThreshold > 0 ? tokenThreshold : 8000;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }

    public boolean shouldSummarize(String context) {
        return this.enabled && estimateTokens(context) > this.tokenThreshold;
    }

    /**
     * Returns the compressed context, or the input unchanged when disabled, under threshold,
     * or when the completion fails or comes back empty.
     */
    public String summarize(String context) {
        if (!this.shouldSummarize(context)) {
            return context;
        }
        int originalTokens = estimateTokens(context);
        long start = System.currentTimeMillis();
        try {
            CompletionResult result = this.completionService.complete(null,
                    PromptTemplates.CONTEXT_COMPRESSION_PROMPT.formatted(context), this.timeout);
            if (result.isBlank()) {
                log.warn("Context summarizer returned empty response, using original ({} chars)", context.length());
                return context;
            }
            log.info("Context summarized: {} -> {} chars, ~{} -> ~{} tokens in {}ms",
                    context.length(), result.text().length(), originalTokens,
                    estimateTokens(result.text()), System.currentTimeMillis() - start);
            return result.text();
        }
        catch (LlmCompletionException e) {
            log.warn("Failed to summarize context, using original: {}", e.getMessage());
            return context;
        }
    }
}
