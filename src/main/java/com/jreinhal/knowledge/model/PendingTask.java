package com.jreinhal.knowledge.model;

import java.time.Instant;

/**
 * A background sub-agent invocation that has not reported back yet. {@code caller} is the
 * identity of the request that spawned it and is reused for the result callback.
 */
public record PendingTask(String id, String agentName, String task, String channelId, String threadTs,
                          String sessionId, CallerIdentity caller, Instant startedAt) {
}
