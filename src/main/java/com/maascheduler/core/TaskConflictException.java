package com.maascheduler.core;

/**
 * The request conflicts with the current scheduler state: the task is already running, its resource
 * group is full, or the scheduler mode does not allow the operation.
 */
public class TaskConflictException extends SchedulerException {

    public TaskConflictException(String message) {
        super(message);
    }
}
