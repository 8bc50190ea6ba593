package com.jreinhal.knowledge.session;

public record CompactionResult(boolean compacted, int eventsBefore, int eventsAfter, int tokensBefore, int tokensAfter) {

    public static CompactionResult skipped(int events, int tokens) {
        return new CompactionResult(false, events, events, tokens, tokens);
    }
}
