package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.TranscriptMessage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges chat thread history into a session without duplicating already-seen messages.
 *
 * <p>The last transcript entry is the live message; the agent loop appends it, so it is never
 * synced here. Consecutive messages from the same side are merged into one event.</p>
 */
@Component
public class ThreadMessageSyncer {
    private static final Logger log = LoggerFactory.getLogger(ThreadMessageSyncer.class);
    public static final String AUTHOR = "thread-sync";

    private final SessionStore sessionStore;

    public ThreadMessageSyncer(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * @return number of events appended
     */
    public int sync(Session session, List<TranscriptMessage> transcript) {
        if (transcript == null || transcript.size() <= 1) {
            return 0;
        }
        List<TranscriptMessage> history = transcript.subList(0, transcript.size() - 1);
        String watermark = session.stateString(Session.STATE_LAST_SYNCED_TS);

        List<TranscriptMessage> fresh = new ArrayList<>();
        for (TranscriptMessage message : history) {
            String ts = message.ts();
            if (ts == null || ts.isEmpty()) {
                continue;
            }
            // ts values are fixed-width decimal strings
            if (watermark.isEmpty() || ts.compareTo(watermark) > 0) {
                fresh.add(message);
            }
        }
        if (fresh.isEmpty()) {
            log.debug("No new thread messages for session {} (watermark={})", session.key(), watermark);
            return 0;
        }

        List<Event> events = group(fresh);
        for (Event event : events) {
            this.sessionStore.appendEvent(session, event);
        }
        String newWatermark = fresh.get(fresh.size() - 1).ts();
        this.sessionStore.putState(session, Session.STATE_LAST_SYNCED_TS, newWatermark);
        log.info("Synced {} thread messages as {} events into session {} (watermark {} -> {})",
                fresh.size(), events.size(), session.key(), watermark, newWatermark);
        return events.size();
    }

    static List<Event> group(List<TranscriptMessage> messages) {
        List<Event> events = new ArrayList<>();
        String currentRole = null;
        StringBuilder buffer = new StringBuilder();
        for (TranscriptMessage message : messages) {
            if (message.text() == null || message.text().isEmpty()) {
                continue;
            }
            String role = message.fromBot() ? Event.ROLE_MODEL : Event.ROLE_USER;
            String line = Event.ROLE_USER.equals(role)
                    ? "[" + message.displayName() + "]: " + message.text()
                    : message.text();
            if (role.equals(currentRole)) {
                buffer.append('\n').append(line);
                continue;
            }
            if (currentRole != null) {
                events.add(Event.of(currentRole, AUTHOR, buffer.toString()));
            }
            currentRole = role;
            buffer = new StringBuilder(line);
        }
        if (currentRole != null) {
            events.add(Event.of(currentRole, AUTHOR, buffer.toString()));
        }
        return events;
    }
}
