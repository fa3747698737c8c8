package com.maascheduler.core.retry;

import com.maascheduler.core.executor.RunHandle;
import com.maascheduler.core.executor.TaskExecutor;
import com.maascheduler.core.metrics.SchedulerMetrics;
import com.maascheduler.core.model.CancelReason;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.QueueOrigin;
import com.maascheduler.core.model.RetryPolicy;
import com.maascheduler.core.model.RunResult;
import com.maascheduler.core.model.SuccessRepeatPolicy;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TriggerKey;
import com.maascheduler.core.model.TriggerSpec;
import com.maascheduler.core.model.TriggerType;
import com.maascheduler.core.notification.NotificationSink;
import com.maascheduler.core.notification.NotificationTags;
import com.maascheduler.core.resource.ResourceManager;
import com.maascheduler.core.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tracks failure-retry and success-repeat counters per {@code taskId:triggerIndex} and decides when a
 * finished run is re-enqueued. Also evicts less urgent {@code scheduled} runs when a more urgent
 * {@code scheduled} item arrives for a full resource group.
 * <p>
 * Delayed re-enqueues run on the shared timer and hand the item to a {@link Resubmitter}, which owns
 * the decision of whether to queue it or run it directly.
 */
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    /** Receives items whose retry or repeat delay has elapsed. */
    @FunctionalInterface
    public interface Resubmitter {
        void resubmit(QueueItem item);
    }

    /** Counter values for one trigger key. */
    public record Counters(String key, int failures, int successRepeats, boolean pending) {}

    private final TriggerEvaluator evaluator;
    private final TaskExecutor executor;
    private final ResourceManager resources;
    private final NotificationSink notifications;
    private final SchedulerMetrics metrics;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final Resubmitter resubmitter;

    private final Map<TriggerKey, RetryState> states = new HashMap<>();

    public RetryController(TriggerEvaluator evaluator, TaskExecutor executor, ResourceManager resources,
                           NotificationSink notifications, SchedulerMetrics metrics,
                           ScheduledExecutorService timer, Clock clock, Resubmitter resubmitter) {
        this.evaluator = evaluator;
        this.executor = executor;
        this.resources = resources;
        this.notifications = notifications;
        this.metrics = metrics;
        this.timer = timer;
        this.clock = clock;
        this.resubmitter = resubmitter;
    }

    /**
     * Called when an item is handed to the executor. A fresh scheduler or manual run starts a new cycle:
     * an exhausted failure counter is reset, and a scheduler run resets the success-repeat count.
     */
    public void onDispatch(QueueItem item) {
        if (!item.origin().isFresh()) {
            return;
        }
        synchronized (states) {
            RetryState state = states.get(item.retryKey());
            if (state == null) {
                return;
            }
            if (state.failures > item.task().retryPolicy().maxRetries()) {
                state.failures = 0;
                state.notified = false;
            }
            if (item.origin() == QueueOrigin.SCHEDULER) {
                state.successRepeats = 0;
            }
            dropIfIdle(item.retryKey(), state);
        }
    }

    /**
     * Updates counters after a run and schedules whatever follow-up run the policies call for.
     */
    public void onRunFinished(QueueItem item, RunResult result) {
        if (result.cancelled()) {
            onCancelled(item, result.cancelReason());
        } else if (result.success()) {
            onSuccess(item);
        } else {
            onFailure(item);
        }
    }

    /**
     * Cancels, with reason {@code preempt}, every running task that the incoming item outranks.
     * <p>
     * Only applies when the incoming item comes from an active {@code scheduled} trigger and its group has
     * no free slot. A victim must be in the same group, have a numerically larger priority, and itself be
     * running under an active {@code scheduled} trigger.
     *
     * @return ids of the tasks that were asked to stop
     */
    public List<String> preemptFor(QueueItem incoming) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!isActiveScheduled(incoming, now)) {
            return List.of();
        }
        String group = incoming.task().resourceGroup();
        if (!resources.isFull(group)) {
            return List.of();
        }

        List<String> evicted = new ArrayList<>();
        for (RunHandle handle : executor.runningInvocations().values()) {
            QueueItem victim = handle.item();
            if (!victim.task().resourceGroup().equals(group)
                    || victim.taskId().equals(incoming.taskId())
                    || victim.priority() <= incoming.priority()
                    || !isActiveScheduled(victim, now)) {
                continue;
            }
            if (executor.cancel(victim.taskId(), CancelReason.PREEMPT)) {
                log.info("Task {} (priority {}) preempted by {} (priority {}) in group {}",
                        victim.taskId(), victim.priority(), incoming.taskId(), incoming.priority(), group);
                metrics.recordPreemption(victim.taskId());
                evicted.add(victim.taskId());
            }
        }
        return evicted;
    }

    /** Drops counters and pending re-enqueues of one task. */
    public void clear(String taskId) {
        synchronized (states) {
            Iterator<Map.Entry<TriggerKey, RetryState>> it = states.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<TriggerKey, RetryState> entry = it.next();
                if (entry.getKey().taskId().equals(taskId)) {
                    entry.getValue().cancelPending();
                    it.remove();
                }
            }
        }
    }

    /** Drops every counter and pending re-enqueue. */
    public void clearAll() {
        synchronized (states) {
            states.values().forEach(RetryState::cancelPending);
            int count = states.size();
            states.clear();
            if (count > 0) {
                log.info("Cleared retry state of {} trigger(s)", count);
            }
        }
    }

    public List<Counters> counters() {
        synchronized (states) {
            List<Counters> result = new ArrayList<>();
            states.forEach((key, state) -> result.add(
                    new Counters(key.toString(), state.failures, state.successRepeats, state.pending != null)));
            return result;
        }
    }

    public int failureCount(TriggerKey key) {
        synchronized (states) {
            RetryState state = states.get(key);
            return state == null ? 0 : state.failures;
        }
    }

    public int successRepeatCount(TriggerKey key) {
        synchronized (states) {
            RetryState state = states.get(key);
            return state == null ? 0 : state.successRepeats;
        }
    }

    // -- Outcome handling -----------------------------------------------------

    private void onCancelled(QueueItem item, CancelReason reason) {
        if (reason != CancelReason.PREEMPT) {
            return;
        }
        if (isActiveScheduled(item, LocalDateTime.now(clock))) {
            log.info("Re-queueing preempted task {}", item.taskId());
            resubmitter.resubmit(item.resumeAfterPreemption());
        } else {
            log.info("Window of preempted task {} has closed, not re-queueing", item.taskId());
        }
    }

    private void onFailure(QueueItem item) {
        TaskDefinition task = item.task();
        RetryPolicy policy = task.retryPolicy();
        TriggerKey key = item.retryKey();
        if (!policy.enabled()) {
            clearKey(key);
            return;
        }
        if (policy.maxRetries() <= 0) {
            return;
        }

        int attempt;
        boolean sendAlert = false;
        synchronized (states) {
            RetryState state = states.computeIfAbsent(key, k -> new RetryState());
            attempt = ++state.failures;
            Integer threshold = policy.notifyAfterRetries();
            if (threshold != null && threshold > 0 && attempt >= threshold
                    && attempt <= policy.maxRetries() && !state.notified) {
                state.notified = true;
                sendAlert = true;
            }
            if (attempt > policy.maxRetries()) {
                state.cancelPending();
                log.error("Task {} failed {} times on {}, giving up until the next trigger",
                        task.id(), attempt, key);
            } else {
                state.cancelPending();
                QueueItem retry = item.retry(attempt);
                state.pending = schedule(key, retry, policy.delay());
                log.warn("Task {} failed, retry {}/{} in {}s", task.id(), attempt, policy.maxRetries(),
                        policy.delay().toSeconds());
                metrics.recordRetryScheduled(task.id());
            }
        }

        if (sendAlert) {
            String title = "Task retry: " + task.name();
            String content = "Task '%s' has failed %d time(s); retry %d of %d is scheduled."
                    .formatted(task.name(), attempt, attempt, policy.maxRetries());
            try {
                notifications.notify(title, content, NotificationTags.TASK_RETRY);
            } catch (RuntimeException e) {
                log.warn("Retry alert for {} failed: {}", task.id(), e.getMessage());
            }
        }
    }

    private void onSuccess(QueueItem item) {
        TriggerKey key = item.retryKey();
        SuccessRepeatPolicy repeat = item.task().retryPolicy().successRepeat();
        LocalDateTime now = LocalDateTime.now(clock);

        synchronized (states) {
            RetryState state = states.get(key);
            if (state != null) {
                state.failures = 0;
                state.notified = false;
                state.cancelPending();
            }

            if (!repeat.enabled() || !isActiveScheduled(item, now)) {
                if (state != null) {
                    state.successRepeats = 0;
                    dropIfIdle(key, state);
                }
                return;
            }

            if (state == null) {
                state = new RetryState();
                states.put(key, state);
            }
            if (repeat.maxRepeats() != null && state.successRepeats >= repeat.maxRepeats()) {
                log.info("Task {} reached {} success repeat(s) on {}, stopping for this window",
                        item.taskId(), state.successRepeats, key);
                return;
            }
            state.successRepeats++;
            state.pending = schedule(key, item.successRepeat(state.successRepeats), repeat.delay());
            log.info("Task {} succeeded inside its window, repeat {} in {}s", item.taskId(),
                    state.successRepeats, repeat.delay().toSeconds());
            metrics.recordSuccessRepeat(item.taskId());
        }
    }

    // -- Helpers --------------------------------------------------------------

    private ScheduledFuture<?> schedule(TriggerKey key, QueueItem item, Duration delay) {
        return timer.schedule(() -> fire(key, item), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void fire(TriggerKey key, QueueItem item) {
        synchronized (states) {
            RetryState state = states.get(key);
            if (state != null) {
                state.pending = null;
            }
        }
        try {
            resubmitter.resubmit(item);
        } catch (RuntimeException e) {
            log.error("Could not re-enqueue task {}: {}", item.taskId(), e.getMessage(), e);
        }
    }

    private boolean isActiveScheduled(QueueItem item, LocalDateTime now) {
        if (item.triggerType() != TriggerType.SCHEDULED) {
            return false;
        }
        TriggerSpec trigger = item.task().trigger(item.triggerKey());
        return trigger instanceof TriggerSpec.Scheduled && evaluator.isWindowActive(trigger, now);
    }

    private void clearKey(TriggerKey key) {
        synchronized (states) {
            RetryState state = states.remove(key);
            if (state != null) {
                state.cancelPending();
            }
        }
    }

    private void dropIfIdle(TriggerKey key, RetryState state) {
        if (state.failures == 0 && state.successRepeats == 0 && state.pending == null) {
            states.remove(key);
        }
    }

    private static final class RetryState {
        int failures;
        boolean notified;
        int successRepeats;
        ScheduledFuture<?> pending;

        void cancelPending() {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }
}
