package com.maascheduler.core;

public class TaskNotFoundException extends SchedulerException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }
}
