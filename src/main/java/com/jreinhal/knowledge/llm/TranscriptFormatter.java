package com.jreinhal.knowledge.llm;

import com.jreinhal.knowledge.model.TranscriptMessage;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders thread history as numbered lines for the instruction.
 */
public final class TranscriptFormatter {
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private TranscriptFormatter() {
    }

    public static String format(List<TranscriptMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (TranscriptMessage message : messages) {
            sb.append('[').append(index++).append("] ").append(message.displayName()).append(": ")
                    .append(message.text() == null ? "" : message.text()).append('\n');
            if (message.ts() != null && !message.ts().isEmpty()) {
                sb.append("   (time: ").append(formatTimestamp(message.ts())).append(")\n");
            }
            if (!message.images().isEmpty()) {
                sb.append("   Attached ").append(message.images().size()).append(" image(s)\n");
            }
        }
        return sb.toString();
    }

    /**
     * Converts a "seconds.micros" chat timestamp to a readable UTC time; unparseable input is returned as is.
     */
    public static String formatTimestamp(String ts) {
        int dot = ts.indexOf('.');
        String seconds = dot >= 0 ? ts.substring(0, dot) : ts;
        try {
            return TIME_FORMAT.format(Instant.ofEpochSecond(Long.parseLong(seconds)));
        }
        catch (NumberFormatException e) {
            return ts;
        }
    }
}
