package com.maascheduler.core.config;

import com.maascheduler.core.SchedulerException;

/**
 * The task catalog or persisted state could not be read or written.
 */
public class ConfigurationException extends SchedulerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
