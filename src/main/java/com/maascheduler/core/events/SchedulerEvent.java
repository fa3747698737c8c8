package com.maascheduler.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the scheduler for live-status consumers.
 *
 * @param eventType one of the constants below, e.g. {@code task.status}
 * @param taskId    task the event concerns, or {@code null} for scheduler-wide events
 * @param payload   event-specific data
 * @param timestamp when the event was created
 */
public record SchedulerEvent(
        String eventType,
        String taskId,
        Map<String, Object> payload,
        Instant timestamp
) implements Serializable {

    public static final String SCHEDULER_STARTED = "scheduler.started";
    public static final String SCHEDULER_STOPPED = "scheduler.stopped";
    public static final String SCHEDULER_MODE = "scheduler.mode";
    public static final String TASK_STATUS = "task.status";
    public static final String TASK_HISTORY = "task.history";
    public static final String TASK_LIST = "task.list";

    public static SchedulerEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new SchedulerEvent(eventType, taskId, payload == null ? Map.of() : payload, Instant.now());
    }
}
