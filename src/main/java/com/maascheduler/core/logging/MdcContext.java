package com.maascheduler.core.logging;

import com.maascheduler.core.model.QueueItem;
import org.slf4j.MDC;

/**
 * MDC keys stamped on every log line produced while an invocation runs.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String RUN_ID = "runId";
    public static final String TRIGGER_KEY = "triggerKey";
    public static final String ORIGIN = "origin";

    private MdcContext() {}

    public static void setRun(String taskId, String runId) {
        MDC.put(TASK_ID, taskId);
        MDC.put(RUN_ID, runId);
    }

    public static void setItem(QueueItem item) {
        MDC.put(TASK_ID, item.taskId());
        MDC.put(ORIGIN, item.origin().label());
        if (item.triggerKey() != null) {
            MDC.put(TRIGGER_KEY, item.triggerKey().toString());
        }
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(RUN_ID);
        MDC.remove(TRIGGER_KEY);
        MDC.remove(ORIGIN);
    }
}
