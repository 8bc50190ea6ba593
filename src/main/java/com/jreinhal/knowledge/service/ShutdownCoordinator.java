package com.jreinhal.knowledge.service;

import com.jreinhal.knowledge.task.BackgroundTaskRegistry;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Drains background tasks under their own grace period, then closes the remaining long-lived
 * resources in parallel under one global timeout. A resource that does not finish in time is
 * reported and left behind; it never holds up the others.
 */
@Component
public class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    static final String BACKGROUND_TASKS = "background-tasks";

    private final Map<String, Runnable> resources = new LinkedHashMap<>();
    private final BackgroundTaskRegistry taskRegistry;
    private final long timeoutSeconds;

    public ShutdownCoordinator(BackgroundTaskRegistry taskRegistry,
                               @Qualifier("agentExecutor") ExecutorService agentExecutor,
                               @Value("${knowledge.shutdown.timeout-seconds:5}") long timeoutSeconds) {
        this.taskRegistry = taskRegistry;
        this.timeoutSeconds = timeoutSeconds;
        this.register("agent-executor", agentExecutor::shutdown);
    }

    public synchronized void register(String name, Runnable closer) {
        this.resources.put(name, closer);
    }

    /**
     * @return names of resources that failed or did not close within the timeout
     */
    @PreDestroy
    public synchronized List<String> shutdown() {
        List<String> failed = new ArrayList<>();
        this.drainBackgroundTasks(failed);
        if (this.resources.isEmpty()) {
            return failed;
        }
        log.info("Closing {} resources (timeout {}s)", this.resources.size(), this.timeoutSeconds);
        ExecutorService closers = Executors.newFixedThreadPool(this.resources.size(), runnable -> {
            Thread thread = new Thread(runnable, "shutdown-closer");
            thread.setDaemon(true);
            return thread;
        });
        Map<String, CompletableFuture<Void>> futures = new LinkedHashMap<>();
        this.resources.forEach((name, closer) -> futures.put(name, CompletableFuture.runAsync(closer, closers)));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(this.timeoutSeconds);
        try {
            for (Map.Entry<String, CompletableFuture<Void>> entry : futures.entrySet()) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                try {
                    entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                }
                catch (TimeoutException e) {
                    log.warn("Resource {} did not close within {}s", entry.getKey(), this.timeoutSeconds);
                    failed.add(entry.getKey());
                }
                catch (java.util.concurrent.ExecutionException e) {
                    log.error("Resource {} failed to close", entry.getKey(), e.getCause());
                    failed.add(entry.getKey());
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while closing {}", entry.getKey());
                    failed.add(entry.getKey());
                }
            }
        }
        finally {
            closers.shutdownNow();
            this.resources.clear();
        }
        if (failed.isEmpty()) {
            log.info("All resources closed");
        }
        return failed;
    }

    /**
     * Runs before the parallel close so the registry's grace period is not cut short by the
     * global timeout. The registry bounds the wait itself.
     */
    private void drainBackgroundTasks(List<String> failed) {
        try {
            int cancelled = this.taskRegistry.shutdown();
            if (cancelled > 0) {
                log.warn("{} background tasks were cancelled after the grace period", cancelled);
                failed.add(BACKGROUND_TASKS);
            }
        }
        catch (RuntimeException e) {
            log.error("Failed to drain background tasks", e);
            failed.add(BACKGROUND_TASKS);
        }
    }
}
