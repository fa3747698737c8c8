package com.maascheduler.core.scheduler;

import com.maascheduler.core.TaskConflictException;
import com.maascheduler.core.TaskNotFoundException;
import com.maascheduler.core.config.AppStateStore;
import com.maascheduler.core.config.ConfigurationException;
import com.maascheduler.core.config.ConfigurationSource;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.events.EventBus;
import com.maascheduler.core.events.SchedulerEvent;
import com.maascheduler.core.executor.RunHandle;
import com.maascheduler.core.executor.TaskExecutor;
import com.maascheduler.core.history.RunRecord;
import com.maascheduler.core.metrics.SchedulerMetrics;
import com.maascheduler.core.model.CancelReason;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.ResourceGroupStatus;
import com.maascheduler.core.model.RunResult;
import com.maascheduler.core.model.SchedulerMode;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TaskStatus;
import com.maascheduler.core.model.TriggerKey;
import com.maascheduler.core.model.TriggerSpec;
import com.maascheduler.core.notification.NotificationSink;
import com.maascheduler.core.notification.NotificationTags;
import com.maascheduler.core.queue.TaskQueue;
import com.maascheduler.core.resource.ResourceManager;
import com.maascheduler.core.retry.RetryController;
import com.maascheduler.core.trigger.TriggerEvaluator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Operator-facing facade over the scheduling core.
 * <p>
 * Owns the task cache (replaced wholesale on reload), the {@link SchedulingTimeline}, the
 * {@link WorkerLoop} and the {@link RetryController}, and drives the shared queue, resource manager and
 * executor. All control operations are serialized on this instance; the hot paths (timer fires, worker
 * dispatch, run completion) only touch the thread-safe collaborators.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final ConfigurationSource config;
    private final AppStateStore stateStore;
    private final TaskQueue queue;
    private final ResourceManager resources;
    private final TaskExecutor executor;
    private final EventBus eventBus;
    private final NotificationSink notifications;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final Duration admissionBackoff;

    private final SchedulingTimeline timeline;
    private final RetryController retries;
    private final WorkerLoop worker;

    private volatile Map<String, TaskDefinition> tasks = Map.of();
    private volatile boolean catalogLoaded;
    private volatile boolean running;
    private volatile SchedulerMode mode;
    private volatile LocalDateTime startedAt;

    @Autowired
    public TaskScheduler(ConfigurationSource config, AppStateStore stateStore, TaskQueue queue,
                         ResourceManager resources, TaskExecutor executor, TriggerEvaluator evaluator,
                         EventBus eventBus, NotificationSink notifications, SchedulerMetrics metrics,
                         ScheduledExecutorService schedulerTimer, Clock schedulerClock,
                         SchedulerProperties properties) {
        this(config, stateStore, queue, resources, executor, evaluator, eventBus, notifications, metrics,
                schedulerTimer, schedulerClock, properties.getScheduler().getWorkerPollInterval(),
                properties.getScheduler().getAdmissionBackoff());
    }

    public TaskScheduler(ConfigurationSource config, AppStateStore stateStore, TaskQueue queue,
                         ResourceManager resources, TaskExecutor executor, TriggerEvaluator evaluator,
                         EventBus eventBus, NotificationSink notifications, SchedulerMetrics metrics,
                         ScheduledExecutorService timer, Clock clock, Duration pollInterval,
                         Duration admissionBackoff) {
        this.config = config;
        this.stateStore = stateStore;
        this.queue = queue;
        this.resources = resources;
        this.executor = executor;
        this.eventBus = eventBus;
        this.notifications = notifications;
        this.timer = timer;
        this.clock = clock;
        this.admissionBackoff = admissionBackoff;
        this.mode = stateStore.getMode();

        this.timeline = new SchedulingTimeline(evaluator, timer, clock, this::onTriggerFired);
        this.retries = new RetryController(evaluator, executor, resources, notifications, metrics, timer, clock,
                this::resubmit);
        this.worker = new WorkerLoop(queue, resources, executor, metrics, this::currentTask, this::dispatch,
                pollInterval, admissionBackoff);
    }

    // -- Lifecycle ------------------------------------------------------------

    /**
     * Loads the catalog, starts the worker loop and, in scheduler mode, arms every trigger.
     *
     * @return false when already running
     * @throws ConfigurationException when the catalog cannot be read
     */
    public synchronized boolean start() {
        if (running) {
            log.info("Scheduler already running");
            return false;
        }
        loadCatalog();
        running = true;
        startedAt = LocalDateTime.now(clock);
        worker.start();
        if (mode == SchedulerMode.SCHEDULER) {
            timeline.armAll(tasks.values());
        }
        log.info("Scheduler started in {} mode with {} task(s)", mode.label(), tasks.size());

        eventBus.publish(SchedulerEvent.SCHEDULER_STARTED, null, Map.of("mode", mode.label()));
        publishTaskList();
        sendStatusNotification("Scheduler started",
                "Scheduler started in %s mode with %d task(s).".formatted(mode.label(), tasks.size()));
        return true;
    }

    /**
     * Disarms every trigger, stops the worker, purges the queue, then cancels running invocations and
     * waits for them. Dispatch halts before any slot is freed, so nothing starts after the stop.
     *
     * @return false when not running
     */
    public synchronized boolean stop() {
        if (!running) {
            log.info("Scheduler is not running");
            return false;
        }
        running = false;
        timeline.disarmAll();
        retries.clearAll();
        worker.stop(STOP_TIMEOUT);
        int purged = queue.clear();
        executor.cancelAll(CancelReason.STOP, STOP_TIMEOUT);
        // runs that ended during the wait may have scheduled follow-ups
        retries.clearAll();
        startedAt = null;
        log.info("Scheduler stopped, {} queued item(s) discarded", purged);

        eventBus.publish(SchedulerEvent.SCHEDULER_STOPPED, null, Map.of("purged", purged));
        publishTaskList();
        sendStatusNotification("Scheduler stopped", "Scheduler stopped.");
        return true;
    }

    /**
     * Re-reads the catalog and rebuilds all runtime state from it: timers and retry counters are reset,
     * queue items of removed or disabled tasks are purged and their running invocations cancelled.
     *
     * @return number of tasks loaded
     */
    public synchronized int reload() {
        config.reload();
        timeline.disarmAll();
        retries.clearAll();
        cacheTasks(config.getTasks());
        resources.loadGroups(config.getResourceGroups());

        Set<String> enabledIds = tasks.values().stream()
                .filter(TaskDefinition::enabled)
                .map(TaskDefinition::id)
                .collect(Collectors.toSet());
        int purged = queue.retain(enabledIds);
        if (purged > 0) {
            log.info("Purged {} queued item(s) of removed or disabled tasks", purged);
        }
        for (String taskId : executor.runningTaskIds()) {
            if (!enabledIds.contains(taskId)) {
                executor.cancel(taskId, CancelReason.DISABLED);
            }
        }

        if (running && mode == SchedulerMode.SCHEDULER) {
            timeline.armAll(tasks.values());
        }
        log.info("Reloaded {} task(s)", tasks.size());
        publishTaskList();
        return tasks.size();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    // -- Operator commands ----------------------------------------------------

    /**
     * Runs a task immediately, outside the queue.
     *
     * @throws TaskNotFoundException when the task does not exist
     * @throws TaskConflictException when the scheduler is running in scheduler mode, the task is already
     *                               running, or its resource group has no free slot
     */
    public CompletableFuture<RunResult> runOnce(String taskId) {
        TaskDefinition task = requireTask(taskId);
        if (running && mode == SchedulerMode.SCHEDULER) {
            throw new TaskConflictException("Scheduler is running in scheduler mode; enqueue the task instead");
        }
        if (executor.isRunning(taskId)) {
            throw new TaskConflictException("Task " + taskId + " is already running");
        }
        if (!resources.tryAllocate(task)) {
            throw new TaskConflictException("Resource group " + task.resourceGroup() + " has no free slot");
        }
        log.info("Running task {} once", taskId);
        return dispatch(QueueItem.manual(task));
    }

    /**
     * Adds a manual run request to the queue.
     *
     * @throws TaskConflictException when the scheduler is not running in scheduler mode or the task is
     *                               disabled
     */
    public void enqueue(String taskId) {
        TaskDefinition task = requireTask(taskId);
        if (!running || mode != SchedulerMode.SCHEDULER) {
            throw new TaskConflictException("Scheduler is not running in scheduler mode");
        }
        if (!task.enabled()) {
            throw new TaskConflictException("Task " + taskId + " is disabled");
        }
        queue.put(QueueItem.manual(task));
        log.info("Task {} enqueued manually", taskId);
        publishTaskList();
    }

    /**
     * Removes the task's queued items, cancels its running invocation and drops pending retries.
     *
     * @return true if anything was removed or cancelled
     */
    public boolean cancel(String taskId) {
        TaskDefinition task = requireTask(taskId);
        int removed = queue.remove(taskId);
        retries.clear(taskId);
        boolean cancelled = executor.cancel(taskId, CancelReason.MANUAL);
        if (removed > 0) {
            log.info("Removed {} queued item(s) of task {}", removed, taskId);
            rearmIdleIntervals(task);
        }
        publishTaskList();
        return cancelled || removed > 0;
    }

    /**
     * Switches between scheduler and single-task mode. Entering single-task mode disarms every trigger,
     * purges the queue and cancels running invocations.
     */
    public synchronized void setMode(SchedulerMode newMode) {
        if (newMode == mode) {
            return;
        }
        SchedulerMode previous = mode;
        mode = newMode;
        stateStore.setMode(newMode);
        log.info("Scheduler mode changed: {} -> {}", previous.label(), newMode.label());

        if (newMode == SchedulerMode.SINGLE_TASK) {
            timeline.disarmAll();
            retries.clearAll();
            int purged = queue.clear();
            executor.cancelAll(CancelReason.MODE_SWITCH, STOP_TIMEOUT);
            log.info("Entered single-task mode, {} queued item(s) discarded", purged);
        } else if (running) {
            timeline.armAll(tasks.values());
        }
        eventBus.publish(SchedulerEvent.SCHEDULER_MODE, null,
                Map.of("mode", newMode.label(), "previous", previous.label()));
        publishTaskList();
    }

    /**
     * Persists the task's enabled flag and applies it to the runtime state of that task only.
     */
    public synchronized void setTaskEnabled(String taskId, boolean enabled) {
        requireTask(taskId);
        config.setTaskEnabled(taskId, enabled);
        TaskDefinition updated = config.getTasks().stream()
                .filter(task -> task.id().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        Map<String, TaskDefinition> copy = new LinkedHashMap<>(tasks);
        copy.put(taskId, updated);
        tasks = Collections.unmodifiableMap(copy);

        if (!updated.enabled()) {
            timeline.disarm(taskId);
            int purged = queue.remove(taskId);
            retries.clear(taskId);
            executor.cancel(taskId, CancelReason.DISABLED);
            log.info("Task {} disabled, {} queued item(s) purged", taskId, purged);
        } else if (running && mode == SchedulerMode.SCHEDULER) {
            timeline.arm(updated);
            log.info("Task {} enabled and armed", taskId);
        }
        publishTaskList();
    }

    // -- Queries --------------------------------------------------------------

    public SchedulerStatus getStatus() {
        ensureCatalog();
        Map<String, TaskDefinition> snapshot = tasks;
        LocalDateTime started = startedAt;
        long uptime = started == null ? 0 : Duration.between(started, LocalDateTime.now(clock)).toSeconds();
        List<String> queued = queue.snapshot().stream().map(QueueItem::taskId).toList();
        return new SchedulerStatus(
                running,
                mode.label(),
                started,
                uptime,
                snapshot.size(),
                (int) snapshot.values().stream().filter(TaskDefinition::enabled).count(),
                queued.size(),
                queued,
                List.copyOf(executor.runningTaskIds()),
                timeline.armedCount(),
                resources.status(),
                retries.counters());
    }

    public List<TaskSummary> listTasks() {
        ensureCatalog();
        Set<String> queued = queue.snapshot().stream().map(QueueItem::taskId).collect(Collectors.toSet());
        List<TaskSummary> summaries = new ArrayList<>();
        for (TaskDefinition task : tasks.values()) {
            boolean isRunning = executor.isRunning(task.id());
            boolean isQueued = queued.contains(task.id());
            summaries.add(new TaskSummary(
                    task.id(),
                    task.name(),
                    task.description(),
                    task.enabled(),
                    task.priority(),
                    task.resourceGroup(),
                    task.primaryTriggerType(),
                    task.triggers().size(),
                    statusLabel(task.id(), isRunning, isQueued),
                    isRunning,
                    isQueued,
                    timeline.nextFireTime(task.id()).orElse(null)));
        }
        return summaries;
    }

    public TaskDefinition getTask(String taskId) {
        return requireTask(taskId);
    }

    public List<String> getLiveLog(String taskId, int limit) {
        requireTask(taskId);
        return executor.getLiveLog(taskId, limit);
    }

    public List<RunRecord> getHistory(int limit) {
        return executor.getHistory(limit);
    }

    public List<ResourceGroupStatus> getResourceGroupStatus() {
        ensureCatalog();
        return resources.status();
    }

    public boolean isRunning() {
        return running;
    }

    public SchedulerMode getMode() {
        return mode;
    }

    // -- Internal flow --------------------------------------------------------

    /**
     * Timer callback: enqueues a scheduled item unless the scheduler is not dispatching or the task is
     * disabled, already running or already queued. Scheduled-window items may preempt first.
     */
    boolean onTriggerFired(TriggerKey key, TriggerSpec trigger, LocalDateTime fireTime) {
        if (!running || mode != SchedulerMode.SCHEDULER) {
            return false;
        }
        TaskDefinition task = tasks.get(key.taskId());
        if (task == null || !task.enabled()) {
            return false;
        }
        if (executor.isRunning(task.id()) || queue.contains(task.id())) {
            log.info("Trigger {} fired but task {} is already running or queued, skipping", key, task.id());
            return false;
        }

        QueueItem item = QueueItem.scheduled(task, key, trigger.type());
        List<String> evicted = retries.preemptFor(item);
        if (!evicted.isEmpty()) {
            log.info("Task {} preempted {}", task.id(), evicted);
        }
        queue.put(item);
        log.info("Trigger {} ({}) fired, task {} enqueued", key, trigger.type().label(), task.id());
        publishTaskList();
        return true;
    }

    /**
     * Hands an item whose resource slot is already held to the executor.
     */
    CompletableFuture<RunResult> dispatch(QueueItem item) {
        retries.onDispatch(item);
        CompletableFuture<RunResult> future = executor.submit(item);
        future.whenComplete((result, error) -> {
            if (error != null) {
                log.error("Run of task {} completed exceptionally: {}", item.taskId(), error.getMessage(), error);
                return;
            }
            onRunFinished(item, result);
        });
        return future;
    }

    private void onRunFinished(QueueItem item, RunResult result) {
        try {
            TaskDefinition current = tasks.get(item.taskId());
            boolean live = current != null && current.enabled();
            TriggerKey key = item.triggerKey();
            if (live && key != null && running && mode == SchedulerMode.SCHEDULER
                    && current.trigger(key) instanceof TriggerSpec.Interval interval) {
                timeline.rearmInterval(key, interval, result.endTime());
            }
            if (live) {
                retries.onRunFinished(item.withTask(current), result);
            }
        } catch (RuntimeException e) {
            log.error("Post-run handling of task {} failed: {}", item.taskId(), e.getMessage(), e);
        }
        publishTaskList();
    }

    /**
     * Delivers a retry, success-repeat or preempted item: through the queue while dispatching in scheduler
     * mode, directly otherwise. A direct run that cannot start yet is retried after the admission backoff.
     */
    private void resubmit(QueueItem item) {
        TaskDefinition current = tasks.get(item.taskId());
        if (current == null || (!current.enabled() && item.triggerKey() != null)) {
            log.info("Dropping {} run of task {}: task is gone or disabled", item.origin().label(), item.taskId());
            return;
        }
        QueueItem fresh = item.withTask(current);
        if (running && mode == SchedulerMode.SCHEDULER) {
            queue.put(fresh);
            log.info("Task {} re-queued ({})", item.taskId(), item.origin().label());
            publishTaskList();
            return;
        }
        if (executor.isRunning(current.id()) || !resources.tryAllocate(current)) {
            log.info("Task {} cannot start yet, trying {} run again in {}s", current.id(),
                    item.origin().label(), admissionBackoff.toSeconds());
            timer.schedule(() -> resubmit(fresh), admissionBackoff.toMillis(), TimeUnit.MILLISECONDS);
            return;
        }
        try {
            dispatch(fresh);
        } catch (TaskConflictException e) {
            log.info("Task {} started concurrently, dropping {} run", current.id(), item.origin().label());
        }
    }

    /**
     * Re-arms interval triggers left disarmed by a fire whose item was purged before it ran. The trigger
     * of a run still in flight is re-armed by that run's completion instead.
     */
    private void rearmIdleIntervals(TaskDefinition task) {
        if (!running || mode != SchedulerMode.SCHEDULER || !task.enabled()) {
            return;
        }
        RunHandle handle = executor.runningInvocations().get(task.id());
        TriggerKey inFlight = handle == null ? null : handle.item().triggerKey();
        LocalDateTime now = LocalDateTime.now(clock);
        for (int i = 0; i < task.triggers().size(); i++) {
            TriggerKey key = TriggerKey.of(task.id(), i);
            if (task.triggers().get(i) instanceof TriggerSpec.Interval interval
                    && !key.equals(inFlight) && timeline.fireTimeOf(key).isEmpty()) {
                timeline.rearmInterval(key, interval, now);
                log.info("Interval trigger {} re-armed after its queued run was cancelled", key);
            }
        }
    }

    private TaskDefinition currentTask(String taskId) {
        return tasks.get(taskId);
    }

    private TaskDefinition requireTask(String taskId) {
        ensureCatalog();
        TaskDefinition task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private void loadCatalog() {
        config.reload();
        cacheTasks(config.getTasks());
        resources.loadGroups(config.getResourceGroups());
    }

    private void ensureCatalog() {
        if (!catalogLoaded) {
            synchronized (this) {
                if (!catalogLoaded) {
                    try {
                        cacheTasks(config.getTasks());
                        resources.loadGroups(config.getResourceGroups());
                    } catch (ConfigurationException e) {
                        log.warn("Task catalog unavailable: {}", e.getMessage());
                    }
                }
            }
        }
    }

    private void cacheTasks(List<TaskDefinition> definitions) {
        Map<String, TaskDefinition> byId = new LinkedHashMap<>();
        for (TaskDefinition task : definitions) {
            byId.put(task.id(), task);
        }
        tasks = Collections.unmodifiableMap(byId);
        catalogLoaded = true;
    }

    private String statusLabel(String taskId, boolean isRunning, boolean isQueued) {
        if (isRunning) {
            return "running";
        }
        if (isQueued) {
            return "queued";
        }
        TaskStatus last = executor.statusOf(taskId);
        return last == null ? "idle" : last.name().toLowerCase();
    }

    private void publishTaskList() {
        try {
            eventBus.publish(SchedulerEvent.TASK_LIST, null, Map.of("tasks", listTasks()));
        } catch (RuntimeException e) {
            log.warn("Could not publish task list: {}", e.getMessage());
        }
    }

    private void sendStatusNotification(String title, String content) {
        try {
            notifications.notify(title, content, NotificationTags.SCHEDULER_STATUS);
        } catch (RuntimeException e) {
            log.warn("Scheduler status notification failed: {}", e.getMessage());
        }
    }
}
