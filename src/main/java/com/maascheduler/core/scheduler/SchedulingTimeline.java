package com.maascheduler.core.scheduler;

import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TriggerKey;
import com.maascheduler.core.model.TriggerSpec;
import com.maascheduler.core.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of armed trigger timers, at most one per {@link TriggerKey}.
 * <p>
 * Arming a {@code scheduled} trigger whose window is already open also fires it once, immediately,
 * so that a start, reload or enable inside the window does not wait for the next day.
 * <p>
 * When a timer fires the {@link FireHandler} decides whether an item is enqueued, and the timer is
 * re-armed according to the trigger type. Interval triggers are the exception: once a fire is
 * accepted they stay disarmed until {@link #rearmInterval} is called with the completion time.
 */
public class SchedulingTimeline {

    private static final Logger log = LoggerFactory.getLogger(SchedulingTimeline.class);

    /** Invoked on the timer thread when a trigger fires. Must not block. */
    @FunctionalInterface
    public interface FireHandler {
        /**
         * @return true if the fire produced a queue item
         */
        boolean onFire(TriggerKey key, TriggerSpec trigger, LocalDateTime fireTime);
    }

    private final TriggerEvaluator evaluator;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final FireHandler handler;

    private final Map<TriggerKey, Armed> armed = new HashMap<>();

    public SchedulingTimeline(TriggerEvaluator evaluator, ScheduledExecutorService timer, Clock clock,
                              FireHandler handler) {
        this.evaluator = evaluator;
        this.timer = timer;
        this.clock = clock;
        this.handler = handler;
    }

    /** Arms every trigger of every enabled task. */
    public void armAll(Collection<TaskDefinition> tasks) {
        int count = 0;
        for (TaskDefinition task : tasks) {
            if (task.enabled()) {
                count += arm(task);
            }
        }
        log.info("Armed {} trigger(s)", count);
    }

    /**
     * Arms every trigger of the task, replacing timers already armed for it, and fires the
     * {@code scheduled} triggers whose window is open now.
     *
     * @return number of triggers armed
     */
    public int arm(TaskDefinition task) {
        LocalDateTime now = LocalDateTime.now(clock);
        int count = 0;
        Map<TriggerKey, TriggerSpec> openWindows = new LinkedHashMap<>();
        for (int i = 0; i < task.triggers().size(); i++) {
            TriggerSpec trigger = task.triggers().get(i);
            TriggerKey key = TriggerKey.of(task.id(), i);
            if (trigger instanceof TriggerSpec.Invalid) {
                disarm(key);
                continue;
            }
            Optional<LocalDateTime> next = evaluator.nextFireTime(trigger, now);
            if (next.isEmpty()) {
                log.info("Trigger {} ({}) has no future fire time", key, trigger.type().label());
                disarm(key);
                continue;
            }
            armAt(key, trigger, next.get());
            count++;
            if (trigger instanceof TriggerSpec.Scheduled && evaluator.isWindowActive(trigger, now)) {
                openWindows.put(key, trigger);
            }
        }
        openWindows.forEach((key, trigger) -> fireOpenWindow(key, trigger, now));
        return count;
    }

    /**
     * Re-arms an interval trigger relative to when its run completed.
     */
    public void rearmInterval(TriggerKey key, TriggerSpec.Interval trigger, LocalDateTime completedAt) {
        armAt(key, trigger, evaluator.nextAfterCompletion(trigger, completedAt));
    }

    public void disarm(TriggerKey key) {
        synchronized (armed) {
            Armed entry = armed.remove(key);
            if (entry != null) {
                entry.future.cancel(false);
            }
        }
    }

    /** Disarms every trigger of one task. */
    public void disarm(String taskId) {
        synchronized (armed) {
            Iterator<Map.Entry<TriggerKey, Armed>> it = armed.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<TriggerKey, Armed> entry = it.next();
                if (entry.getKey().taskId().equals(taskId)) {
                    entry.getValue().future.cancel(false);
                    it.remove();
                }
            }
        }
    }

    public void disarmAll() {
        synchronized (armed) {
            armed.values().forEach(entry -> entry.future.cancel(false));
            armed.clear();
        }
    }

    /** Earliest armed fire time among the task's triggers. */
    public Optional<LocalDateTime> nextFireTime(String taskId) {
        synchronized (armed) {
            return armed.entrySet().stream()
                    .filter(entry -> entry.getKey().taskId().equals(taskId))
                    .map(entry -> entry.getValue().fireTime)
                    .min(LocalDateTime::compareTo);
        }
    }

    public Optional<LocalDateTime> fireTimeOf(TriggerKey key) {
        synchronized (armed) {
            Armed entry = armed.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.fireTime);
        }
    }

    public int armedCount() {
        synchronized (armed) {
            return armed.size();
        }
    }

    // -- Firing ---------------------------------------------------------------

    void armAt(TriggerKey key, TriggerSpec trigger, LocalDateTime fireTime) {
        long delayMs = Math.max(0, Duration.between(LocalDateTime.now(clock), fireTime).toMillis());
        synchronized (armed) {
            Armed previous = armed.get(key);
            if (previous != null) {
                previous.future.cancel(false);
            }
            Armed entry = new Armed(trigger, fireTime);
            entry.future = timer.schedule(() -> fire(key, entry), delayMs, TimeUnit.MILLISECONDS);
            armed.put(key, entry);
        }
        log.debug("Trigger {} armed for {}", key, fireTime);
    }

    private void fire(TriggerKey key, Armed entry) {
        synchronized (armed) {
            if (armed.get(key) != entry) {
                return;
            }
        }

        boolean accepted;
        try {
            accepted = handler.onFire(key, entry.trigger, entry.fireTime);
        } catch (RuntimeException e) {
            log.error("Trigger {} failed to fire: {}", key, e.getMessage(), e);
            accepted = false;
        }

        synchronized (armed) {
            // disarmed or replaced while the handler ran
            if (armed.get(key) != entry) {
                return;
            }
            armed.remove(key);
        }
        rearmAfterFire(key, entry, accepted);
    }

    private void fireOpenWindow(TriggerKey key, TriggerSpec trigger, LocalDateTime now) {
        log.info("Window of trigger {} is already open, firing now", key);
        try {
            handler.onFire(key, trigger, now);
        } catch (RuntimeException e) {
            log.error("Trigger {} failed to fire: {}", key, e.getMessage(), e);
        }
    }

    private void rearmAfterFire(TriggerKey key, Armed entry, boolean accepted) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime reference = now.isAfter(entry.fireTime) ? now : entry.fireTime;
        TriggerSpec trigger = entry.trigger;

        if (trigger instanceof TriggerSpec.Interval interval) {
            if (!accepted) {
                armAt(key, trigger, evaluator.nextAfterCompletion(interval, now));
            }
            return;
        }
        Optional<LocalDateTime> next = trigger instanceof TriggerSpec.RandomTime random
                ? Optional.of(evaluator.nextRandomAfterFire(random, entry.fireTime))
                : evaluator.nextFireTime(trigger, reference);
        if (next.isPresent()) {
            armAt(key, trigger, next.get());
        } else {
            log.info("Trigger {} has fired its last date", key);
        }
    }

    private static final class Armed {
        final TriggerSpec trigger;
        final LocalDateTime fireTime;
        ScheduledFuture<?> future;

        Armed(TriggerSpec trigger, LocalDateTime fireTime) {
            this.trigger = trigger;
            this.fireTime = fireTime;
        }
    }
}
