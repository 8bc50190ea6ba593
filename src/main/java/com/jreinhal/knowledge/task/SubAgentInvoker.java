package com.jreinhal.knowledge.task;

import com.jreinhal.knowledge.config.SubAgentProperties;

public interface SubAgentInvoker {

    /**
     * Sends {@code task} to the sub-agent and blocks until it answers.
     *
     * @throws SubAgentException when the call fails or the agent reports an error
     */
    String invoke(SubAgentProperties.SubAgent agent, String task);
}
