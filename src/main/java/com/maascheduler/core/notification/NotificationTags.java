package com.maascheduler.core.notification;

/**
 * Channel tags attached to scheduler notifications.
 */
public final class NotificationTags {

    public static final String TASK_SUCCESS = "task-success";
    public static final String TASK_FAILURE = "task-failure";
    public static final String TASK_RETRY = "task-retry";
    public static final String TASK_CANCELLED = "task-cancelled";
    public static final String TASK_ERROR = "task-error";
    public static final String SCHEDULER_STATUS = "scheduler-status";
    public static final String TEST = "test";

    private NotificationTags() {}
}
