package com.jreinhal.knowledge.llm;

import com.jreinhal.knowledge.util.SimpleCircuitBreaker;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ChatClientCompletionService implements CompletionService {
    private static final Logger log = LoggerFactory.getLogger(ChatClientCompletionService.class);

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final SimpleCircuitBreaker circuitBreaker;

    public ChatClientCompletionService(ChatClient.Builder builder,
                                       @Qualifier("agentExecutor") ExecutorService executor,
                                       @Value("${knowledge.llm.circuit-breaker.failure-threshold:5}") int failureThreshold,
                                       @Value("${knowledge.llm.circuit-breaker.open-seconds:30}") long openSeconds,
                                       @Value("${knowledge.llm.circuit-breaker.half-open-max-calls:1}") int halfOpenMaxCalls) {
        this.chatClient = builder.build();
        this.executor = executor;
        this.circuitBreaker = new SimpleCircuitBreaker("completion", failureThreshold, Duration.ofSeconds(openSeconds), halfOpenMaxCalls);
    }

    @Override
    public CompletionResult complete(String systemPrompt, String userPrompt, Duration timeout) {
        if (!this.circuitBreaker.allowRequest()) {
            throw new LlmCompletionException("Completion backend unavailable (circuit " + this.circuitBreaker.getState() + ")");
        }
        CompletableFuture<ChatResponse> future = CompletableFuture.supplyAsync(() -> {
            ChatClient.ChatClientRequestSpec spec = this.chatClient.prompt();
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                spec = spec.system(systemPrompt);
            }
            return spec.user(userPrompt).call().chatResponse();
        }, this.executor);
        try {
            ChatResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            this.circuitBreaker.recordSuccess();
            return toResult(response);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            this.circuitBreaker.recordFailure();
            log.warn("Completion timed out after {}ms", timeout.toMillis());
            throw new LlmCompletionException("Completion timed out after " + timeout.toSeconds() + "s", e);
        }
        catch (ExecutionException e) {
            this.circuitBreaker.recordFailure();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LlmCompletionException("Completion failed: " + cause.getMessage(), cause);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmCompletionException("Completion interrupted", e);
        }
    }

    static CompletionResult toResult(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return new CompletionResult("", 0, 0);
        }
        String text = response.getResult().getOutput().getText();
        int promptTokens = 0;
        int completionTokens = 0;
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null) {
            promptTokens = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            completionTokens = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        }
        return new CompletionResult(text == null ? "" : text.trim(), promptTokens, completionTokens);
    }
}
