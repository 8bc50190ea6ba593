package com.jreinhal.knowledge.memory;

import com.jreinhal.knowledge.llm.PromptTemplates;
import com.jreinhal.knowledge.model.MemoryEntry;
import com.jreinhal.knowledge.util.LogSanitizer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Looks up long-term memory for the question before the agent loop runs. Never fails the
 * request: errors and timeouts yield an empty string.
 */
@Service
public class MemoryPreSearchService {
    private static final Logger log = LoggerFactory.getLogger(MemoryPreSearchService.class);

    private final MemoryStore memoryStore;
    private final ExecutorService executor;
    private final long timeoutMs;
    private final int maxResults;

    public MemoryPreSearchService(MemoryStore memoryStore,
                                  @Qualifier("agentExecutor") ExecutorService executor,
                                  @Value("${knowledge.presearch.timeout-ms:3000}") long timeoutMs,
                                  @Value("${knowledge.presearch.max-results:5}") int maxResults) {
        this.memoryStore = memoryStore;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.maxResults = maxResults;
    }

    public String preSearch(String query, String userId) {
        if (query == null || query.isBlank()) {
            return "";
        }
        long start = System.currentTimeMillis();
        CompletableFuture<List<MemoryEntry>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.memoryStore.search(userId, query, this.maxResults), this.executor);
        }
        catch (RejectedExecutionException e) {
            log.warn("Pre-search skipped, executor saturated: {}", e.getMessage());
            return "";
        }
        List<MemoryEntry> results;
        try {
            results = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Pre-search timed out after {}ms for query {}", this.timeoutMs, LogSanitizer.textSummary(query));
            return "";
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Pre-search failed for query {}: {}", LogSanitizer.textSummary(query), cause.getMessage());
            return "";
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return "";
        }
        return this.format(results, query, System.currentTimeMillis() - start);
    }

    private String format(List<MemoryEntry> results, String query, long durationMs) {
        if (results == null || results.isEmpty()) {
            log.debug("Pre-search found nothing for query {} in {}ms", LogSanitizer.textSummary(query), durationMs);
            return PromptTemplates.NO_MEMORY_RESULTS;
        }
        StringBuilder sb = new StringBuilder();
        int count = 0;
        for (MemoryEntry entry : results) {
            if (count >= this.maxResults) {
                break;
            }
            if (entry.content() == null || entry.content().isEmpty()) {
                continue;
            }
            count++;
            sb.append(count).append(". ").append(entry.content()).append('\n');
        }
        if (count == 0) {
            return PromptTemplates.NO_MEMORY_RESULTS;
        }
        log.info("Pre-search returned {} of {} results in {}ms", count, results.size(), durationMs);
        return sb.toString();
    }
}
