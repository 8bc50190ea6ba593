package com.jreinhal.knowledge.agent;

import com.jreinhal.knowledge.llm.SystemPromptBuilder;
import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.session.SessionStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Agent loop on Spring AI's {@link ChatClient}: the session history becomes the message list,
 * memory and sub-agent tools are attached, and the caller identity travels in the tool context.
 */
@Component
public class ChatClientAgentRunner implements AgentRunner {
    private static final Logger log = LoggerFactory.getLogger(ChatClientAgentRunner.class);
    public static final String AUTHOR = "knowledge-agent";
    public static final String USER_AUTHOR = "user";

    private final ChatClient chatClient;
    private final SessionStore sessionStore;
    private final MemoryTools memoryTools;
    private final SubAgentTools subAgentTools;
    private final ExecutorService executor;
    private final long timeoutSeconds;

    public ChatClientAgentRunner(ChatClient.Builder builder, SystemPromptBuilder promptBuilder, SessionStore sessionStore,
                                 MemoryTools memoryTools, SubAgentTools subAgentTools,
                                 @Qualifier("agentExecutor") ExecutorService executor,
                                 @Value("${knowledge.llm.timeout-seconds:120}") long timeoutSeconds) {
        this.chatClient = builder.defaultSystem(promptBuilder.systemPrompt()).build();
        this.sessionStore = sessionStore;
        this.memoryTools = memoryTools;
        this.subAgentTools = subAgentTools;
        this.executor = executor;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public AgentRunResult run(AgentRunRequest request) {
        Session session = this.sessionStore.get(request.sessionKey())
                .orElseThrow(() -> new AgentRunException("Session not found: " + request.sessionKey()));
        List<Message> history = toMessages(session.getEvents());
        Map<String, Object> toolContext = new HashMap<>();
        if (request.caller() != null) {
            toolContext.put(ToolContextKeys.CALLER, request.caller());
        }
        toolContext.put(ToolContextKeys.MEMORY_USER_ID, request.memoryUserId());
        toolContext.put(ToolContextKeys.TOOL_LOG, request.toolLog() != null ? request.toolLog() : new ToolInvocationLog());
        putIfPresent(toolContext, ToolContextKeys.CHANNEL_ID, request.channelId());
        putIfPresent(toolContext, ToolContextKeys.THREAD_TS, request.threadTs());
        putIfPresent(toolContext, ToolContextKeys.SESSION_ID, request.sessionKey().sessionId());

        CompletableFuture<ChatResponse> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.chatClient.prompt()
                    .messages(history)
                    .user(request.instruction())
                    .tools(this.memoryTools, this.subAgentTools)
                    .toolContext(toolContext)
                    .call()
                    .chatResponse(), this.executor);
        }
        catch (RejectedExecutionException e) {
            throw new AgentRunException("Agent executor is saturated", e);
        }
        ChatResponse response;
        try {
            response = future.get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw new AgentRunException("Agent run timed out after " + this.timeoutSeconds + "s", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AgentRunException("Agent run failed: " + cause.getMessage(), cause);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AgentRunException("Agent run interrupted", e);
        }

        String answer = response != null && response.getResult() != null && response.getResult().getOutput() != null
                ? response.getResult().getOutput().getText() : null;
        if (answer == null) {
            answer = "";
        }
        this.sessionStore.appendEvent(session, Event.user(USER_AUTHOR, request.instruction()));
        this.sessionStore.appendEvent(session, Event.model(AUTHOR, answer));
        log.debug("Agent turn persisted to session {} ({} history messages)", request.sessionKey(), history.size());
        Usage usage = response != null && response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        int promptTokens = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
        int completionTokens = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        return new AgentRunResult(answer, promptTokens, completionTokens);
    }

    static List<Message> toMessages(List<Event> events) {
        List<Message> messages = new ArrayList<>(events.size());
        for (Event event : events) {
            String text = event.text();
            if (text.isEmpty()) {
                continue;
            }
            messages.add(event.isUser() ? new UserMessage(text) : new AssistantMessage(text));
        }
        return messages;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isEmpty()) {
            map.put(key, value);
        }
    }
}
