package com.jreinhal.knowledge.agent;

import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.SessionKey;

/**
 * One agent-loop turn. {@code memoryUserId} is the memory partition the tools operate on.
 */
public record AgentRunRequest(SessionKey sessionKey, String instruction, CallerIdentity caller, String memoryUserId,
                              String channelId, String threadTs, ToolInvocationLog toolLog) {
}
