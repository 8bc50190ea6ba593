package com.jreinhal.knowledge.task;

import com.jreinhal.knowledge.config.SubAgentProperties;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.PendingTask;
import com.jreinhal.knowledge.util.LogSanitizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Owns sub-agent tasks that outlive the request that started them.
 *
 * <p>Tasks run on their own executor and are tracked by id until they finish. A shutdown stops
 * new submissions, waits up to the configured grace period, then cancels whatever is left.
 * Results of tasks finishing after shutdown began are dropped.</p>
 */
@Component
public class BackgroundTaskRegistry {
    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskRegistry.class);

    private final Map<String, TaskHandle> tasks = new ConcurrentHashMap<>();
    private final AtomicInteger reservedSlots = new AtomicInteger(0);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final ExecutorService executor;
    private final SubAgentInvoker invoker;
    private final SubAgentProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BackgroundTaskRegistry(@Qualifier("backgroundTaskExecutor") ExecutorService executor, SubAgentInvoker invoker,
                                  SubAgentProperties properties, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.executor = executor;
        this.invoker = invoker;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException for an unknown agent
     * @throws IllegalStateException when shutting down or at the concurrency limit
     */
    public PendingTask submit(String agentName, String task, TaskOrigin origin) {
        if (this.shuttingDown.get()) {
            throw new IllegalStateException("Shutting down, not accepting new background tasks");
        }
        SubAgentProperties.SubAgent agent = this.properties.find(agentName).orElseThrow(() -> new IllegalArgumentException(
                "unknown agent '" + agentName + "'. Available agents: " + this.availableAgents()));
        this.reserveSlot();
        String id = "async-" + agentName + "-" + System.nanoTime();
        PendingTask pending = new PendingTask(id, agentName, task, origin.channelId(), origin.threadTs(),
                origin.sessionId(), origin.caller(), this.clock.instant());
        FutureTask<Void> future = new FutureTask<>(() -> {
            this.execute(pending, agent);
            return null;
        });
        this.tasks.put(id, new TaskHandle(pending, future));
        try {
            this.executor.execute(future);
        }
        catch (RejectedExecutionException e) {
            this.release(id);
            throw new IllegalStateException("Background executor is saturated", e);
        }
        log.info("Started background task {} for agent {} {}", id, agentName, LogSanitizer.textSummary(task));
        return pending;
    }

    private void execute(PendingTask pending, SubAgentProperties.SubAgent agent) {
        String result = null;
        String error = null;
        try {
            result = this.invoker.invoke(agent, pending.task());
        }
        catch (RuntimeException e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        finally {
            this.release(pending.id());
        }
        Duration duration = Duration.between(pending.startedAt(), this.clock.instant());
        if (this.shuttingDown.get() || Thread.currentThread().isInterrupted()) {
            log.info("Background task {} finished during shutdown or after cancellation, result not posted", pending.id());
            return;
        }
        if (error != null) {
            log.error("Background task {} ({}) failed after {}s: {}", pending.id(), pending.agentName(), duration.toSeconds(), error);
        }
        else {
            log.info("Background task {} ({}) completed in {}s, {} chars", pending.id(), pending.agentName(), duration.toSeconds(),
                    result == null ? 0 : result.length());
        }
        this.eventPublisher.publishEvent(new BackgroundTaskCompletedEvent(pending, result, error, duration));
    }

    /**
     * Cancels tasks running longer than the configured task timeout.
     */
    @Scheduled(fixedDelayString = "${knowledge.async.reaper-interval-ms:60000}")
    public void cancelExpired() {
        Instant cutoff = this.clock.instant().minus(Duration.ofMinutes(this.properties.getTimeoutMinutes()));
        for (TaskHandle handle : List.copyOf(this.tasks.values())) {
            if (handle.task().startedAt().isBefore(cutoff)) {
                log.warn("Background task {} exceeded {} minutes, cancelling", handle.task().id(), this.properties.getTimeoutMinutes());
                handle.future().cancel(true);
                this.release(handle.task().id());
            }
        }
    }

    public List<PendingTask> pendingTasks() {
        List<PendingTask> pending = new ArrayList<>();
        for (TaskHandle handle : this.tasks.values()) {
            pending.add(handle.task());
        }
        pending.sort(Comparator.comparing(PendingTask::startedAt));
        return pending;
    }

    public boolean isShuttingDown() {
        return this.shuttingDown.get();
    }

    /**
     * Stops accepting tasks, waits up to the grace period and cancels the rest.
     *
     * @return number of tasks cancelled
     */
    public int shutdown() {
        return this.shutdown(Duration.ofSeconds(this.properties.getShutdownGraceSeconds()));
    }

    public int shutdown(Duration grace) {
        if (!this.shuttingDown.compareAndSet(false, true)) {
            return 0;
        }
        log.info("Draining {} background tasks (grace {}s)", this.tasks.size(), grace.toSeconds());
        long deadline = System.nanoTime() + grace.toNanos();
        for (TaskHandle handle : List.copyOf(this.tasks.values())) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) {
                break;
            }
            try {
                handle.future().get(remaining, TimeUnit.NANOSECONDS);
            }
            catch (TimeoutException e) {
                break;
            }
            catch (ExecutionException | CancellationException e) {
                log.debug("Background task {} ended abnormally during drain", handle.task().id());
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int cancelled = 0;
        for (TaskHandle handle : List.copyOf(this.tasks.values())) {
            handle.future().cancel(true);
            this.release(handle.task().id());
            cancelled++;
        }
        if (cancelled > 0) {
            log.warn("Cancelled {} background tasks still running after grace period", cancelled);
        }
        return cancelled;
    }

    private void reserveSlot() {
        int max = this.properties.getMaxConcurrent();
        while (true) {
            int reserved = this.reservedSlots.get();
            if (reserved >= max) {
                throw new IllegalStateException("too many pending tasks (" + reserved + "/" + max
                        + "). Please wait for some tasks to complete.");
            }
            if (this.reservedSlots.compareAndSet(reserved, reserved + 1)) {
                return;
            }
        }
    }

    /**
     * Frees the slot of a tracked task; a task already released is ignored.
     */
    private void release(String id) {
        if (this.tasks.remove(id) != null) {
            this.reservedSlots.decrementAndGet();
        }
    }

    private List<String> availableAgents() {
        return this.properties.getSubAgents().stream().map(SubAgentProperties.SubAgent::getName).toList();
    }

    /**
     * Where a task came from; results are routed back to the same conversation.
     */
    public record TaskOrigin(String channelId, String threadTs, String sessionId, CallerIdentity caller) {
    }

    private record TaskHandle(PendingTask task, FutureTask<Void> future) {
    }
}
