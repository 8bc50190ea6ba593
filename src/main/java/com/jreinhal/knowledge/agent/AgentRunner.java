package com.jreinhal.knowledge.agent;

/**
 * The tool-calling agent loop. Reads the session history, runs the turn and appends the
 * instruction and the final answer to the session.
 */
public interface AgentRunner {

    /**
     * @throws AgentRunException when the loop fails; the cause chain carries the backend error
     */
    AgentRunResult run(AgentRunRequest request);
}
