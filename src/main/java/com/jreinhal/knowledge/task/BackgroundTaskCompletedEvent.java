package com.jreinhal.knowledge.task;

import com.jreinhal.knowledge.model.PendingTask;
import java.time.Duration;

/**
 * Published when a sub-agent task finishes, successfully or not, while the process is still running.
 */
public record BackgroundTaskCompletedEvent(PendingTask task, String result, String error, Duration duration) {

    public boolean succeeded() {
        return this.error == null;
    }
}
