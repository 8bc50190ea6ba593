package com.jreinhal.knowledge.agent;

import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.PendingTask;
import com.jreinhal.knowledge.task.BackgroundTaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

@Component
public class SubAgentTools {
    private static final Logger log = LoggerFactory.getLogger(SubAgentTools.class);

    private final BackgroundTaskRegistry taskRegistry;

    public SubAgentTools(BackgroundTaskRegistry taskRegistry) {
        this.taskRegistry = taskRegistry;
    }

    @Tool(name = "async_invoke_agent", description = "Invoke a sub-agent asynchronously for long-running tasks (5-15 minutes). "
            + "Returns immediately; the result is posted back to this conversation when complete.")
    public String asyncInvokeAgent(@ToolParam(description = "Name of the sub-agent") String agentName,
                                   @ToolParam(description = "Complete task description for the sub-agent") String task,
                                   ToolContext toolContext) {
        Object caller = MemoryTools.contextValue(toolContext, ToolContextKeys.CALLER);
        BackgroundTaskRegistry.TaskOrigin origin = new BackgroundTaskRegistry.TaskOrigin(
                stringValue(toolContext, ToolContextKeys.CHANNEL_ID),
                stringValue(toolContext, ToolContextKeys.THREAD_TS),
                stringValue(toolContext, ToolContextKeys.SESSION_ID),
                caller instanceof CallerIdentity identity ? identity : null);
        try {
            PendingTask pending = this.taskRegistry.submit(agentName, task, origin);
            return "Task sent to " + agentName + ". Results will be posted to this thread when complete. Task ID: " + pending.id();
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("async_invoke_agent rejected: {}", e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private static String stringValue(ToolContext toolContext, String key) {
        Object value = MemoryTools.contextValue(toolContext, key);
        return value instanceof String s ? s : null;
    }
}
