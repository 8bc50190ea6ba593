package com.jreinhal.knowledge.util;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal three-state breaker guarding calls to the completion backend.
 */
public class SimpleCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int halfOpenMaxCalls;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger trialCalls = new AtomicInteger(0);
    private volatile long reopenAtMs = 0L;
    private volatile State state = State.CLOSED;

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls) {
        this(name, failureThreshold, openDuration, halfOpenMaxCalls, Clock.systemUTC());
    }

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = this.clock.millis();
        if (this.state == State.OPEN) {
            if (now < this.reopenAtMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.reopenAtMs) {
                    this.state = State.HALF_OPEN;
                    this.trialCalls.set(0);
                }
            }
        }
        return this.trialCalls.incrementAndGet() <= this.halfOpenMaxCalls;
    }

    public void recordSuccess() {
        if (this.state == State.CLOSED) {
            this.consecutiveFailures.set(0);
            return;
        }
        synchronized (this) {
            this.state = State.CLOSED;
            this.consecutiveFailures.set(0);
            this.trialCalls.set(0);
            this.reopenAtMs = 0L;
        }
    }

    public void recordFailure() {
        if (this.state == State.HALF_OPEN) {
            this.trip();
            return;
        }
        if (this.consecutiveFailures.incrementAndGet() >= this.failureThreshold) {
            this.trip();
        }
    }

    public State getState() {
        return this.state;
    }

    public String getName() {
        return this.name;
    }

    private synchronized void trip() {
        this.state = State.OPEN;
        this.reopenAtMs = this.clock.millis() + this.openDuration.toMillis();
        this.consecutiveFailures.set(0);
        this.trialCalls.set(0);
    }
}
