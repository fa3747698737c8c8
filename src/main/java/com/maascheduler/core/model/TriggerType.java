package com.maascheduler.core.model;

import java.util.Locale;

/**
 * Discriminator of the {@link TriggerSpec} variants, using the names found in the task catalog.
 */
public enum TriggerType {
    SCHEDULED("scheduled"),
    INTERVAL("interval"),
    RANDOM_TIME("random_time"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    SPECIFIC_DATE("specific_date"),
    /** Placeholder for a catalog entry that could not be parsed; never fires. */
    INVALID("invalid");

    private final String label;

    TriggerType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TriggerType fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Trigger type is missing");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TriggerType type : values()) {
            if (type != INVALID && type.label.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + value);
    }
}
