package com.maascheduler.core.executor;

import com.maascheduler.core.model.CancelReason;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.RunResult;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

/**
 * A running invocation: what it runs, on which thread, and whether it has been asked to stop.
 */
public final class RunHandle {

    private final QueueItem item;
    private final String runId;
    private final LocalDateTime startedAt;
    private final CompletableFuture<RunResult> completion = new CompletableFuture<>();

    private volatile Thread thread;
    private volatile CancelReason cancelReason;

    RunHandle(QueueItem item, String runId, LocalDateTime startedAt) {
        this.item = item;
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public QueueItem item() {
        return item;
    }

    public String runId() {
        return runId;
    }

    public LocalDateTime startedAt() {
        return startedAt;
    }

    public CancelReason cancelReason() {
        return cancelReason;
    }

    public CompletableFuture<RunResult> completion() {
        return completion;
    }

    synchronized void bind(Thread runner) {
        this.thread = runner;
    }

    /**
     * Detaches the runner thread so a late cancel cannot interrupt whatever the pooled thread runs
     * next, then clears any interrupt already delivered.
     */
    synchronized void unbind() {
        this.thread = null;
        Thread.interrupted();
    }

    /**
     * Records the reason and interrupts the runner thread. The first reason wins.
     *
     * @return false when the invocation was already cancelled or finished
     */
    synchronized boolean cancel(CancelReason reason) {
        if (cancelReason != null || completion.isDone()) {
            return false;
        }
        cancelReason = reason;
        Thread runner = thread;
        if (runner != null) {
            runner.interrupt();
        }
        return true;
    }

    boolean isCancelled() {
        return cancelReason != null;
    }
}
