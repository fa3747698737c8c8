package com.maascheduler.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A pending run request. Created when a trigger fires or an operator asks for a run, destroyed at dispatch.
 *
 * @param task          task snapshot at enqueue time
 * @param triggerKey    trigger that produced the item, or {@code null} for manual requests
 * @param origin        provenance of the request
 * @param triggerType   type of the producing trigger, or {@code null}
 * @param retryAttempt  failure-retry attempt number (0 for the initial attempt)
 * @param repeatAttempt success-repeat attempt number (0 unless {@code origin} is success-repeat)
 * @param enqueuedAt    creation time
 */
public record QueueItem(
        TaskDefinition task,
        TriggerKey triggerKey,
        QueueOrigin origin,
        TriggerType triggerType,
        int retryAttempt,
        int repeatAttempt,
        Instant enqueuedAt
) {

    public QueueItem {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(origin, "origin");
        enqueuedAt = enqueuedAt == null ? Instant.now() : enqueuedAt;
    }

    public static QueueItem scheduled(TaskDefinition task, TriggerKey key, TriggerType type) {
        return new QueueItem(task, key, QueueOrigin.SCHEDULER, type, 0, 0, Instant.now());
    }

    public static QueueItem manual(TaskDefinition task) {
        return new QueueItem(task, null, QueueOrigin.MANUAL, null, 0, 0, Instant.now());
    }

    public String taskId() {
        return task.id();
    }

    public int priority() {
        return task.priority();
    }

    /** Key used for retry bookkeeping: the trigger key, or {@code taskId:manual}. */
    public TriggerKey retryKey() {
        return triggerKey != null ? triggerKey : TriggerKey.manual(task.id());
    }

    public QueueItem retry(int attempt) {
        return new QueueItem(task, triggerKey, QueueOrigin.RETRY, triggerType, attempt, repeatAttempt, Instant.now());
    }

    public QueueItem successRepeat(int repeat) {
        return new QueueItem(task, triggerKey, QueueOrigin.SUCCESS_REPEAT, triggerType, 0, repeat, Instant.now());
    }

    public QueueItem resumeAfterPreemption() {
        return new QueueItem(task, triggerKey, QueueOrigin.PREEMPTED, triggerType, retryAttempt, repeatAttempt,
                Instant.now());
    }

    public QueueItem withTask(TaskDefinition replacement) {
        return new QueueItem(replacement, triggerKey, origin, triggerType, retryAttempt, repeatAttempt, enqueuedAt);
    }

    public Map<String, Object> metadata() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("origin", origin.label());
        map.put("triggerKey", triggerKey == null ? null : triggerKey.toString());
        map.put("triggerType", triggerType == null ? null : triggerType.label());
        map.put("retryAttempt", retryAttempt);
        map.put("repeatAttempt", repeatAttempt);
        return map;
    }
}
