package com.jreinhal.knowledge.llm;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Strips process narration ("let me search...") from final answers.
 */
@Service
public class ResponseCleaner {
    private static final Logger log = LoggerFactory.getLogger(ResponseCleaner.class);

    private final CompletionService completionService;
    private final boolean enabled;
    private final int minLength;
    private final Duration timeout;

    public ResponseCleaner(CompletionService completionService,
                           @Value("${knowledge.response-cleaner.enabled:false}") boolean enabled,
                           @Value("${knowledge.response-cleaner.min-length:200}") int minLength,
                           @Value("${knowledge.response-cleaner.timeout-seconds:30}") long timeoutSeconds) {
        this.completionService = completionService;
        this.enabled = enabled;
        this.minLength = minLength;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public String clean(String response) {
        if (!this.enabled || response == null) {
            return response;
        }
        if (response.length() < this.minLength) {
            log.debug("Response too short to clean ({} chars)", response.length());
            return response;
        }
        try {
            CompletionResult result = this.completionService.complete(null,
                    PromptTemplates.RESPONSE_CLEANUP_PROMPT.formatted(response), this.timeout);
            if (result.isBlank()) {
                return response;
            }
            log.debug("Response cleaned: {} -> {} chars", response.length(), result.text().length());
            return result.text();
        }
        catch (LlmCompletionException e) {
            log.warn("Failed to clean response, returning original: {}", e.getMessage());
            return response;
        }
    }
}
