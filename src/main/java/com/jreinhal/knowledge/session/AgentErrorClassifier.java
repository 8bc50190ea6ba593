package com.jreinhal.knowledge.session;

import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Sorts agent-loop failures into the ones the session layer can repair and the rest.
 */
@Component
public class AgentErrorClassifier {

    public enum ErrorKind {
        ORPHANED_TOOL_CALL,
        CONTEXT_OVERFLOW,
        OTHER
    }

    public ErrorKind classify(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message == null) {
                continue;
            }
            if (isOrphanedToolCall(message)) {
                return ErrorKind.ORPHANED_TOOL_CALL;
            }
            if (isContextOverflow(message)) {
                return ErrorKind.CONTEXT_OVERFLOW;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return ErrorKind.OTHER;
    }

    /**
     * A tool invocation was persisted without its result, e.g. "tool_use ids were found without tool_result blocks".
     */
    static boolean isOrphanedToolCall(String message) {
        return message.contains("tool_use") && message.contains("tool_result") && message.contains("without");
    }

    static boolean isContextOverflow(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("prompt is too long")
                || lower.contains("too many tokens")
                || lower.contains("maximum context length")
                || lower.contains("content too large");
    }
}
