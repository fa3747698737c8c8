package com.maascheduler.core.executor;

import com.maascheduler.core.SchedulerException;

/**
 * A pre-task step (connect, resolution change, wake, launch) failed. The main command is not run.
 */
public class DevicePreparationException extends SchedulerException {

    public DevicePreparationException(String message) {
        super(message);
    }

    public DevicePreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}
