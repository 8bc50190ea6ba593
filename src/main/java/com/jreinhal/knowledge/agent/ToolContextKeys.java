package com.jreinhal.knowledge.agent;

final class ToolContextKeys {
    static final String CALLER = "caller";
    static final String MEMORY_USER_ID = "memoryUserId";
    static final String TOOL_LOG = "toolLog";
    static final String CHANNEL_ID = "channelId";
    static final String THREAD_TS = "threadTs";
    static final String SESSION_ID = "sessionId";

    private ToolContextKeys() {
    }
}
