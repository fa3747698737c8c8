package com.maascheduler.core.model;

/**
 * Composite key {@code taskId:triggerIndex} identifying one trigger of one task. Manual runs use the
 * {@code taskId:manual} form.
 */
public record TriggerKey(String taskId, int index) {

    private static final int MANUAL = -1;

    public static TriggerKey of(String taskId, int index) {
        return new TriggerKey(taskId, index);
    }

    public static TriggerKey manual(String taskId) {
        return new TriggerKey(taskId, MANUAL);
    }

    public boolean isManual() {
        return index == MANUAL;
    }

    /**
     * Parses the string form produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException when the value has no {@code :} separator or a non-numeric index
     */
    public static TriggerKey parse(String value) {
        int sep = value == null ? -1 : value.lastIndexOf(':');
        if (sep <= 0) {
            throw new IllegalArgumentException("Malformed trigger key: " + value);
        }
        String taskId = value.substring(0, sep);
        String suffix = value.substring(sep + 1);
        if ("manual".equals(suffix)) {
            return manual(taskId);
        }
        try {
            return new TriggerKey(taskId, Integer.parseInt(suffix));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed trigger key: " + value, e);
        }
    }

    @Override
    public String toString() {
        return taskId + ":" + (isManual() ? "manual" : String.valueOf(index));
    }
}
