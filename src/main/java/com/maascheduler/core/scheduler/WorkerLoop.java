package com.maascheduler.core.scheduler;

import com.maascheduler.core.TaskConflictException;
import com.maascheduler.core.executor.TaskExecutor;
import com.maascheduler.core.metrics.SchedulerMetrics;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.queue.TaskQueue;
import com.maascheduler.core.resource.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The sole queue consumer. Pulls items in priority order, drops items of disabled or deleted tasks,
 * checks admission and hands admitted items to the dispatcher without waiting for them to finish.
 * <p>
 * Items that cannot start yet (group full, or the task already running) are deferred inside the
 * {@link TaskQueue} for the rest of the pass so that a busy group never blocks items of other groups,
 * while purges still reach them. Once the queue is drained the deferred items go back and the loop
 * waits for a slot release, or at most the admission backoff.
 */
public class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final TaskQueue queue;
    private final ResourceManager resources;
    private final TaskExecutor executor;
    private final SchedulerMetrics metrics;
    private final Function<String, TaskDefinition> taskLookup;
    private final Consumer<QueueItem> dispatcher;
    private final Duration pollInterval;
    private final Duration admissionBackoff;

    private volatile boolean running;
    private volatile Thread thread;

    /**
     * @param taskLookup current definition of a task id, or {@code null} when it no longer exists
     * @param dispatcher starts an item whose slot has been allocated; may throw
     *                   {@link TaskConflictException} when the task started concurrently
     */
    public WorkerLoop(TaskQueue queue, ResourceManager resources, TaskExecutor executor, SchedulerMetrics metrics,
                      Function<String, TaskDefinition> taskLookup, Consumer<QueueItem> dispatcher,
                      Duration pollInterval, Duration admissionBackoff) {
        this.queue = queue;
        this.resources = resources;
        this.executor = executor;
        this.metrics = metrics;
        this.taskLookup = taskLookup;
        this.dispatcher = dispatcher;
        this.pollInterval = pollInterval;
        this.admissionBackoff = admissionBackoff;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = new Thread(this, "task-worker");
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("Worker loop started");
    }

    /**
     * Stops the loop and waits for it to exit. Once this returns nothing more is dispatched.
     */
    public synchronized void stop(Duration timeout) {
        if (!running) {
            return;
        }
        running = false;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("Worker loop did not stop within {}s", timeout.toSeconds());
            }
        }
        thread = null;
        log.info("Worker loop stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        while (running) {
            try {
                step();
            } catch (InterruptedException e) {
                break;
            } catch (RuntimeException e) {
                log.error("Worker loop error: {}", e.getMessage(), e);
            }
        }
        queue.restoreDeferred();
    }

    void step() throws InterruptedException {
        Optional<QueueItem> next = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        if (next.isEmpty()) {
            if (queue.hasDeferred()) {
                queue.restoreDeferred();
                resources.awaitRelease(admissionBackoff);
            }
            return;
        }

        QueueItem item = next.get();
        TaskDefinition current = taskLookup.apply(item.taskId());
        if (current == null) {
            queue.settle();
            log.info("Dropping queued item of deleted task {}", item.taskId());
            return;
        }
        if (!current.enabled()) {
            queue.settle();
            log.info("Dropping queued item of disabled task {}", item.taskId());
            return;
        }
        item = item.withTask(current);

        if (executor.isRunning(item.taskId())) {
            log.debug("Task {} still running, deferring {} item", item.taskId(), item.origin().label());
            queue.defer(item);
            return;
        }
        if (!resources.tryAllocate(current)) {
            log.debug("Resource group {} is full, deferring task {}", current.resourceGroup(), item.taskId());
            metrics.recordAdmissionDeferral(current.resourceGroup());
            queue.defer(item);
            return;
        }
        if (!queue.settle()) {
            log.info("Task {} was cancelled before dispatch", item.taskId());
            resources.release(current);
            return;
        }

        try {
            dispatcher.accept(item);
        } catch (TaskConflictException e) {
            // the slot belongs to the invocation that won the race
            log.info("Task {} started concurrently, deferring: {}", item.taskId(), e.getMessage());
            queue.defer(item);
        }
    }
}
