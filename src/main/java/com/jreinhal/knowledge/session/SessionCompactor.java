package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.llm.CompletionResult;
import com.jreinhal.knowledge.llm.CompletionService;
import com.jreinhal.knowledge.llm.LlmCompletionException;
import com.jreinhal.knowledge.llm.PromptTemplates;
import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Bounds session size by replacing old events with an LLM summary pair.
 *
 * <p>The original session is only deleted once a non-empty summary exists. The sync watermark
 * is carried into the rebuilt session.</p>
 */
@Service
public class SessionCompactor {
    private static final Logger log = LoggerFactory.getLogger(SessionCompactor.class);
    public static final String AUTHOR = "compactor";

    private final SessionStore sessionStore;
    private final SessionRebuilder sessionRebuilder;
    private final CompletionService completionService;
    private final boolean enabled;
    private final int tokenThreshold;
    private final int keepTurns;
    private final Duration summarizeTimeout;

    public SessionCompactor(SessionStore sessionStore, SessionRebuilder sessionRebuilder, CompletionService completionService,
                            @Value("${knowledge.session.compaction-enabled:true}") boolean enabled,
                            @Value("${knowledge.session.compact-threshold:8000}") int tokenThreshold,
                            @Value("${knowledge.session.compact-keep-turns:4}") int keepTurns,
                            @Value("${knowledge.session.summarize-timeout-seconds:60}") long summarizeTimeoutSeconds) {
        this.sessionStore = sessionStore;
        this.sessionRebuilder = sessionRebuilder;
        this.completionService = completionService;
        this.enabled = enabled;
        this.tokenThreshold = tokenThreshold > 0 ? tokenThreshold : 8000;
        this.keepTurns = keepTurns > 0 ? keepTurns : 4;
        this.summarizeTimeout = Duration.ofSeconds(summarizeTimeoutSeconds > 0 ? summarizeTimeoutSeconds : 60);
    }

    public CompactionResult compactIfNeeded(SessionKey key) {
        if (!this.enabled) {
            return CompactionResult.skipped(0, 0);
        }
        return this.run(key, false);
    }

    /**
     * Compacts regardless of size; used to recover from context overflow.
     */
    public CompactionResult compact(SessionKey key) {
        return this.run(key, true);
    }

    private CompactionResult run(SessionKey key, boolean force) {
        Optional<Session> loaded = this.sessionStore.get(key);
        if (loaded.isEmpty()) {
            log.debug("No session {} to compact", key);
            return CompactionResult.skipped(0, 0);
        }
        Session session = loaded.get();
        List<Event> events = session.getEvents();
        int tokens = estimateTokens(events);
        if (!force && tokens < this.tokenThreshold) {
            log.debug("Session {} below compaction threshold (~{} < {} tokens)", key, tokens, this.tokenThreshold);
            return CompactionResult.skipped(events.size(), tokens);
        }

        int split = Math.max(0, events.size() - this.keepTurns * 2);
        if (split == 0) {
            log.debug("Session {} has no events older than the last {} turns", key, this.keepTurns);
            return CompactionResult.skipped(events.size(), tokens);
        }
        List<Event> oldEvents = events.subList(0, split);
        List<Event> recentEvents = List.copyOf(events.subList(split, events.size()));

        String summary = this.summarize(key, render(oldEvents));
        String watermark = session.stateString(Session.STATE_LAST_SYNCED_TS);
        Map<String, Object> preserved = new HashMap<>();
        if (!watermark.isEmpty()) {
            preserved.put(Session.STATE_LAST_SYNCED_TS, watermark);
        }

        List<Event> rebuilt = new ArrayList<>(recentEvents.size() + 2);
        rebuilt.add(Event.user(AUTHOR, PromptTemplates.SUMMARY_HEADER + summary));
        rebuilt.add(Event.model(AUTHOR, PromptTemplates.SUMMARY_ACK));
        rebuilt.addAll(recentEvents);
        this.sessionRebuilder.rebuildSession(key, preserved, rebuilt);

        int newTokens = estimateTokens(rebuilt);
        log.info("Compacted session {}: {} -> {} events, ~{} -> ~{} tokens (forced={})",
                key, events.size(), rebuilt.size(), tokens, newTokens, force);
        return new CompactionResult(true, events.size(), rebuilt.size(), tokens, newTokens);
    }

    private String summarize(SessionKey key, String transcript) {
        CompletionResult result;
        try {
            result = this.completionService.complete(null, PromptTemplates.COMPACTION_PROMPT.formatted(transcript), this.summarizeTimeout);
        }
        catch (LlmCompletionException e) {
            throw new CompactionException("Summarization failed for session " + key + ": " + e.getMessage(), e);
        }
        if (result.isBlank()) {
            throw new CompactionException("Summarization returned empty summary for session " + key);
        }
        return result.text();
    }

    static String render(List<Event> events) {
        StringBuilder sb = new StringBuilder();
        for (Event event : events) {
            for (String part : event.parts()) {
                if (part == null || part.isEmpty()) {
                    continue;
                }
                sb.append('[').append(event.role()).append("]: ").append(part).append('\n');
            }
        }
        return sb.toString();
    }

    public static int estimateTokens(List<Event> events) {
        return render(events).length() / 4;
    }
}
