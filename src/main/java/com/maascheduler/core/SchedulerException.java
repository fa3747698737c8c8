package com.maascheduler.core;

/**
 * Base class for scheduler failures surfaced to operators.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
