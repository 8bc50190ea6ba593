package com.jreinhal.knowledge.service;

import com.jreinhal.knowledge.config.SubAgentProperties;
import com.jreinhal.knowledge.dto.QueryRequest;
import com.jreinhal.knowledge.dto.QueryResponse;
import com.jreinhal.knowledge.model.PendingTask;
import com.jreinhal.knowledge.model.QueryIntent;
import com.jreinhal.knowledge.task.BackgroundTaskCompletedEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Feeds finished sub-agent results back into the conversation that started them.
 */
@Component
public class BackgroundTaskCallbackListener {
    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskCallbackListener.class);

    private final QueryOrchestrationService orchestrationService;
    private final SubAgentProperties properties;

    public BackgroundTaskCallbackListener(QueryOrchestrationService orchestrationService, SubAgentProperties properties) {
        this.orchestrationService = orchestrationService;
        this.properties = properties;
    }

    @EventListener
    public void onTaskCompleted(BackgroundTaskCompletedEvent event) {
        PendingTask task = event.task();
        if (!this.properties.isCallbackEnabled()) {
            log.debug("Callback disabled, dropping result of task {}", task.id());
            return;
        }
        QueryRequest request = new QueryRequest(callbackMessage(event), task.sessionId(), task.channelId(), task.threadTs(),
                task.caller() != null ? task.caller().slackUserId() : null, List.of(), QueryIntent.QUERY);
        QueryResponse response = this.orchestrationService.processQuery(request, task.caller());
        if (response.success()) {
            log.info("Delivered result of task {} to session {}", task.id(), response.sessionId());
        }
        else {
            log.error("Callback for task {} failed: {}", task.id(), response.message());
        }
    }

    static String callbackMessage(BackgroundTaskCompletedEvent event) {
        PendingTask task = event.task();
        String body = event.succeeded() ? event.result() : "Task failed: " + event.error();
        return "[ASYNC CALLBACK from " + task.agentName() + "]\n\nOriginal task: " + task.task() + "\n\nResult:\n" + body;
    }
}
