package com.maascheduler.core.config;

import com.maascheduler.core.SchedulerException;

/**
 * A single trigger entry is malformed. The entry is skipped; the rest of the task still loads.
 */
public class TriggerFormatException extends SchedulerException {

    public TriggerFormatException(String message) {
        super(message);
    }

    public TriggerFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
