package com.maascheduler.core.executor;

import com.maascheduler.core.TaskConflictException;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.events.EventBus;
import com.maascheduler.core.events.SchedulerEvent;
import com.maascheduler.core.history.RunHistoryStore;
import com.maascheduler.core.history.RunRecord;
import com.maascheduler.core.logging.MdcContext;
import com.maascheduler.core.metrics.SchedulerMetrics;
import com.maascheduler.core.model.CancelReason;
import com.maascheduler.core.model.PostRunHooks;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.QueueOrigin;
import com.maascheduler.core.model.RunResult;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TaskStatus;
import com.maascheduler.core.notification.NotificationSink;
import com.maascheduler.core.notification.NotificationTags;
import com.maascheduler.core.resource.ResourceManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one invocation's full lifecycle: device preparation, the main command as a monitored child
 * process, and post-run hooks.
 * <p>
 * Each invocation runs on its own thread. The caller allocates the resource slot before
 * {@link #submit}; the executor releases it, together with the running-set entry, when the invocation
 * ends however it ends. Exceptions never escape to callers: every invocation completes its future with
 * a {@link RunResult}.
 */
@Service
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ShellRunner shell;
    private final DeviceController devices;
    private final ResourceManager resources;
    private final RunHistoryStore historyStore;
    private final NotificationSink notifications;
    private final EventBus eventBus;
    private final SchedulerMetrics metrics;
    private final LiveLogBuffer liveLog;
    private final int historyLimit;
    private final Clock clock;

    private final ConcurrentHashMap<String, RunHandle> running = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TaskStatus> lastStatus = new ConcurrentHashMap<>();
    private final Deque<RunRecord> history = new ArrayDeque<>();
    private volatile boolean historyLoaded;

    private final ExecutorService workers;

    @Autowired
    public TaskExecutor(ShellRunner shell, DeviceController devices, ResourceManager resources,
                        RunHistoryStore historyStore, NotificationSink notifications, EventBus eventBus,
                        SchedulerMetrics metrics, SchedulerProperties properties) {
        this(shell, devices, resources, historyStore, notifications, eventBus, metrics,
                properties.getScheduler().getLiveLogLines(), properties.getScheduler().getHistoryLimit(),
                Clock.systemDefaultZone());
    }

    public TaskExecutor(ShellRunner shell, DeviceController devices, ResourceManager resources,
                        RunHistoryStore historyStore, NotificationSink notifications, EventBus eventBus,
                        SchedulerMetrics metrics, int liveLogLines, int historyLimit, Clock clock) {
        this.shell = shell;
        this.devices = devices;
        this.resources = resources;
        this.historyStore = historyStore;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.liveLog = new LiveLogBuffer(liveLogLines);
        this.historyLimit = Math.max(1, historyLimit);
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts an invocation asynchronously. The task's resource slot must already be allocated.
     *
     * @return a future completed with the run result once the slot has been released
     * @throws TaskConflictException when the task already has an invocation in flight
     */
    public CompletableFuture<RunResult> submit(QueueItem item) {
        TaskDefinition task = item.task();
        String runId = newRunId();
        RunHandle handle = new RunHandle(item, runId, LocalDateTime.now(clock));
        if (running.putIfAbsent(task.id(), handle) != null) {
            throw new TaskConflictException("Task " + task.id() + " is already running");
        }
        lastStatus.put(task.id(), TaskStatus.PENDING);
        try {
            workers.execute(() -> runInvocation(handle));
        } catch (RejectedExecutionException e) {
            running.remove(task.id(), handle);
            resources.release(task);
            throw new TaskConflictException("Executor is shut down, cannot run " + task.id());
        }
        return handle.completion();
    }

    /**
     * Requests cancellation of the task's running invocation. The invocation observes it at its next
     * blocking point and tears down its child processes before completing.
     *
     * @return true if an invocation was running and had not been cancelled yet
     */
    public boolean cancel(String taskId, CancelReason reason) {
        RunHandle handle = running.get(taskId);
        if (handle == null) {
            return false;
        }
        boolean cancelled = handle.cancel(reason);
        if (cancelled) {
            log.info("Cancelling task {} (run {}), reason: {}", taskId, handle.runId(), reason.label());
        }
        return cancelled;
    }

    /**
     * Cancels every running invocation and waits for all of them to unwind.
     *
     * @return true if everything finished within the timeout
     */
    public boolean cancelAll(CancelReason reason, Duration timeout) {
        List<CompletableFuture<RunResult>> pending = new ArrayList<>();
        for (Map.Entry<String, RunHandle> entry : running.entrySet()) {
            entry.getValue().cancel(reason);
            pending.add(entry.getValue().completion());
        }
        if (pending.isEmpty()) {
            return true;
        }
        log.info("Waiting for {} running task(s) to stop", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("{} task(s) still running after {}s", running.size(), timeout.toSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    public boolean isRunning(String taskId) {
        return running.containsKey(taskId);
    }

    public Set<String> runningTaskIds() {
        return Set.copyOf(running.keySet());
    }

    /** Snapshot of running invocations keyed by task id. */
    public Map<String, RunHandle> runningInvocations() {
        return Map.copyOf(running);
    }

    public TaskStatus statusOf(String taskId) {
        return running.containsKey(taskId) ? TaskStatus.RUNNING : lastStatus.get(taskId);
    }

    public List<String> getLiveLog(String taskId, int limit) {
        return liveLog.tail(taskId, limit);
    }

    /**
     * @return up to {@code limit} most recent runs, newest last
     */
    public List<RunRecord> getHistory(int limit) {
        synchronized (history) {
            loadHistory();
            List<RunRecord> all = new ArrayList<>(history);
            if (limit > 0 && all.size() > limit) {
                return new ArrayList<>(all.subList(all.size() - limit, all.size()));
            }
            return all;
        }
    }

    @PreDestroy
    public void shutdown() {
        cancelAll(CancelReason.STOP, Duration.ofSeconds(15));
        workers.shutdownNow();
    }

    // -- Invocation lifecycle -------------------------------------------------

    private void runInvocation(RunHandle handle) {
        QueueItem item = handle.item();
        TaskDefinition task = item.task();
        handle.bind(Thread.currentThread());
        MdcContext.setItem(item);
        MdcContext.setRun(task.id(), handle.runId());

        liveLog.reset(task.id());
        lastStatus.put(task.id(), TaskStatus.RUNNING);
        publishStatus(task, handle, TaskStatus.RUNNING, null);
        log.info("Starting task {} ({}), origin {}, attempt {}", task.name(), task.id(),
                item.origin().label(), item.retryAttempt());

        Path logFile = prepareLogFile(task, handle);
        RunResult result = null;
        String stdout = "";
        String stderr = "";
        Integer exitCode = null;
        try (RunLog runLog = RunLog.open(logFile, task.logOptions().tempLog())) {
            if (handle.isCancelled()) {
                throw new InterruptedException("cancelled before start");
            }
            OutputListener listener = outputListener(task, runLog);

            boolean skipPreTasks = item.origin() == QueueOrigin.RETRY && !task.retryPolicy().rerunPreTasks();
            if (task.devicePrep() != null && task.devicePrep().hasDevice()) {
                if (skipPreTasks) {
                    log.info("Skipping pre-tasks on retry, ensuring device connection only");
                    devices.ensureConnected(task.devicePrep().deviceId(), listener);
                } else {
                    devices.prepare(task.devicePrep(), listener);
                }
            }

            CommandResult command = shell.run(new ShellCommand(task.command(),
                    task.workingDirectory() == null ? null : Path.of(task.workingDirectory()),
                    task.environment()), listener);
            exitCode = command.exitCode();
            stdout = command.stdout();
            stderr = command.stderr();

            TaskStatus status = command.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
            String message = command.success() ? "Task completed" : "Task failed with exit code " + exitCode;
            result = new RunResult(task.id(), handle.runId(), status, exitCode, stdout, stderr,
                    handle.startedAt(), LocalDateTime.now(clock), message, null);
            if (command.success()) {
                log.info("Task {} completed", task.id());
            } else {
                log.error("Task {} failed with exit code {}", task.id(), exitCode);
            }
        } catch (InterruptedException e) {
            result = cancelledResult(handle, exitCode, stdout, stderr);
        } catch (Exception e) {
            if (handle.isCancelled()) {
                result = cancelledResult(handle, exitCode, stdout, stderr);
            } else {
                log.error("Task {} aborted: {}", task.id(), e.getMessage(), e);
                result = new RunResult(task.id(), handle.runId(), TaskStatus.FAILED, exitCode, stdout, stderr,
                        handle.startedAt(), LocalDateTime.now(clock), "Task aborted: " + e.getMessage(), null);
                if (!(e instanceof DevicePreparationException)) {
                    safeNotify("Task error: " + task.name(), "Task " + task.id() + " raised " + e,
                            NotificationTags.TASK_ERROR);
                }
            }
        } finally {
            handle.unbind();
            if (result == null) {
                result = new RunResult(task.id(), handle.runId(), TaskStatus.FAILED, exitCode, stdout, stderr,
                        handle.startedAt(), LocalDateTime.now(clock), "Task ended unexpectedly", null);
            }
            finish(handle, result, logFile);
        }
    }

    private void finish(RunHandle handle, RunResult result, Path logFile) {
        TaskDefinition task = handle.item().task();
        try {
            if (logFile != null && !task.logOptions().tempLog()) {
                dumpLiveLog(task.id(), logFile);
            }
            runPostHooks(task, result, logFile);

            RunRecord record = RunRecord.of(task, handle.item(), result,
                    logFile == null ? null : logFile.toString());
            synchronized (history) {
                // the loaded snapshot must not contain the record persisted below
                loadHistory();
            }
            try {
                record = historyStore.recordRun(task.id(), result.runId(), record);
            } catch (RuntimeException e) {
                log.error("Cannot record run {} of task {}: {}", result.runId(), task.id(), e.getMessage());
            }
            rememberHistory(record);

            metrics.recordRun(task.id(), result.status().name(), result.duration());
            lastStatus.put(task.id(), result.status());
            publishStatus(task, handle, result.status(), result.message());
            eventBus.publish(SchedulerEvent.TASK_HISTORY, task.id(), Map.of("record", record));
        } catch (RuntimeException e) {
            log.error("Post-run handling of task {} failed: {}", task.id(), e.getMessage(), e);
        } finally {
            running.remove(task.id(), handle);
            resources.release(task);
            MdcContext.clear();
            handle.completion().complete(result);
        }
    }

    private RunResult cancelledResult(RunHandle handle, Integer exitCode, String stdout, String stderr) {
        TaskDefinition task = handle.item().task();
        CancelReason reason = handle.cancelReason() == null ? CancelReason.STOP : handle.cancelReason();
        log.warn("Task {} cancelled ({})", task.id(), reason.label());
        if (!reason.isSilent()) {
            safeNotify("Task cancelled: " + task.name(),
                    "Task " + task.id() + " was cancelled (" + reason.label() + ")", NotificationTags.TASK_CANCELLED);
        }
        String message = reason.isSilent() ? "Task paused for a higher-priority task" : "Task cancelled";
        return new RunResult(task.id(), handle.runId(), TaskStatus.CANCELLED, exitCode, stdout, stderr,
                handle.startedAt(), LocalDateTime.now(clock), message, reason);
    }

    // -- Post-run hooks -------------------------------------------------------

    private void runPostHooks(TaskDefinition task, RunResult result, Path logFile) {
        if (result.cancelled()) {
            return;
        }
        PostRunHooks hooks = task.hooks();

        if (!hooks.keywords().isEmpty()) {
            String content = readLogContent(task, result, logFile);
            List<String> matched = hooks.keywords().stream().filter(content::contains).toList();
            if (!matched.isEmpty()) {
                String joined = String.join(", ", matched);
                log.info("Task {} output matched keywords: {}", task.id(), joined);
                safeNotify(hooks.keywordTitle().replace("{keywords}", joined),
                        hooks.keywordContent().replace("{keywords}", joined), hooks.keywordTag());
            }
        }

        boolean notify = result.success() ? hooks.notifyOnSuccess() : hooks.notifyOnFailure();
        if (notify) {
            String outcome = result.success() ? "succeeded" : "failed";
            String title = hooks.pushTitle() != null ? hooks.pushTitle() : "Task " + task.name() + " " + outcome;
            String content = hooks.pushContent() != null ? hooks.pushContent()
                    : "Task '%s' %s.%nDuration: %.2fs".formatted(task.name(), outcome,
                    result.duration().toMillis() / 1000.0);
            safeNotify(title, content, result.success() ? NotificationTags.TASK_SUCCESS : NotificationTags.TASK_FAILURE);
        }
    }

    private String readLogContent(TaskDefinition task, RunResult result, Path logFile) {
        if (task.logOptions().tempLog() && logFile != null && Files.isRegularFile(logFile)) {
            try {
                String content = Files.readString(logFile, StandardCharsets.UTF_8);
                if (!content.isEmpty()) {
                    return content;
                }
            } catch (IOException e) {
                log.warn("Cannot read log file {}: {}", logFile, e.getMessage());
            }
        }
        return result.stdout() + "\n" + result.stderr();
    }

    private void safeNotify(String title, String content, String tag) {
        try {
            notifications.notify(title, content, tag);
        } catch (RuntimeException e) {
            log.warn("Notification '{}' failed: {}", title, e.getMessage());
        }
    }

    // -- Logging helpers ------------------------------------------------------

    private OutputListener outputListener(TaskDefinition task, RunLog runLog) {
        Logger taskLog = LoggerFactory.getLogger("task." + task.id());
        return (stream, line) -> {
            String tagged = "[" + stream.name() + "] " + line;
            liveLog.append(task.id(), tagged);
            if (task.logOptions().logToGlobal()) {
                taskLog.info("[{}] {}", task.id(), tagged);
            }
            runLog.append("[" + LocalDateTime.now(clock) + "] " + tagged);
        };
    }

    private Path prepareLogFile(TaskDefinition task, RunHandle handle) {
        try {
            return historyStore.logFileFor(task.id(), handle.runId());
        } catch (RuntimeException e) {
            log.warn("No log file for run {}: {}", handle.runId(), e.getMessage());
            return null;
        }
    }

    private void dumpLiveLog(String taskId, Path logFile) {
        String timestamp = LocalDateTime.now(clock).toString();
        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8)) {
            for (String line : liveLog.tail(taskId, 0)) {
                writer.write("[" + timestamp + "] " + line);
                writer.newLine();
            }
        } catch (IOException e) {
            log.error("Cannot write log file {}: {}", logFile, e.getMessage());
        }
    }

    private void rememberHistory(RunRecord record) {
        synchronized (history) {
            loadHistory();
            history.addLast(record);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    private void loadHistory() {
        if (historyLoaded) {
            return;
        }
        historyLoaded = true;
        try {
            history.addAll(historyStore.recentRuns(historyLimit));
        } catch (RuntimeException e) {
            log.warn("Cannot load run history: {}", e.getMessage());
        }
    }

    private void publishStatus(TaskDefinition task, RunHandle handle, TaskStatus status, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.id());
        payload.put("taskName", task.name());
        payload.put("status", status.name());
        payload.put("runId", handle.runId());
        payload.putAll(handle.item().metadata());
        if (message != null) {
            payload.put("message", message);
        }
        eventBus.publish(SchedulerEvent.TASK_STATUS, task.id(), payload);
    }

    private String newRunId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return LocalDateTime.now(clock).format(RUN_ID_FORMAT) + "_" + suffix;
    }
}
