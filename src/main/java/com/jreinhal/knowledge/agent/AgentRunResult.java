package com.jreinhal.knowledge.agent;

public record AgentRunResult(String answer, int promptTokens, int completionTokens) {
}
