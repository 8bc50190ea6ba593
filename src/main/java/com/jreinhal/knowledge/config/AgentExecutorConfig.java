package com.jreinhal.knowledge.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for timeout-bounded LLM and memory calls ({@code agentExecutor}) and for
 * background sub-agent tasks ({@code backgroundTaskExecutor}).
 *
 * <p>Saturated pools reject with {@link RejectedExecutionException} rather than running work on
 * the caller's thread, so a request thread is never tied up by an LLM call it meant to bound.</p>
 */
@Configuration
public class AgentExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutorConfig.class);

    @Bean(name = {"agentExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor agentExecutor(
            @Value("${knowledge.performance.agent-core-threads:4}") int coreThreads,
            @Value("${knowledge.performance.agent-max-threads:16}") int maxThreads,
            @Value("${knowledge.performance.agent-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("agent-exec-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean(name = {"backgroundTaskExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor backgroundTaskExecutor(
            @Value("${knowledge.performance.background-threads:8}") int threads,
            @Value("${knowledge.async.max-concurrent:100}") int maxConcurrent) {
        return this.buildExecutor("subagent-", threads, threads, Math.max(10, maxConcurrent));
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}': active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
