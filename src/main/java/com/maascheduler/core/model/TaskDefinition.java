package com.maascheduler.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A configured automation job. Instances are immutable and replaced wholesale on reload.
 *
 * @param id               unique task identifier
 * @param name             display name
 * @param description      free-form description
 * @param enabled          disabled tasks are never enqueued or dispatched
 * @param priority         lower numbers are more urgent
 * @param resourceGroup    name of the resource group the task occupies while running
 * @param triggers         fire rules, tracked individually under {@link TriggerKey}
 * @param retryPolicy      failure-retry and success-repeat settings
 * @param command          main shell command line
 * @param workingDirectory directory to run the command in, or {@code null} for the current one
 * @param environment      extra environment variables for the command
 * @param devicePrep       device preparation steps, or {@code null} when the task drives no device
 * @param logOptions       output capture flags
 * @param hooks            post-run notifications
 */
public record TaskDefinition(
        String id,
        String name,
        String description,
        boolean enabled,
        int priority,
        String resourceGroup,
        List<TriggerSpec> triggers,
        RetryPolicy retryPolicy,
        String command,
        String workingDirectory,
        Map<String, String> environment,
        DevicePrep devicePrep,
        LogOptions logOptions,
        PostRunHooks hooks
) {

    public TaskDefinition {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        description = description == null ? "" : description;
        resourceGroup = resourceGroup == null || resourceGroup.isBlank() ? ResourceGroup.DEFAULT_GROUP : resourceGroup;
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        retryPolicy = retryPolicy == null ? RetryPolicy.disabled() : retryPolicy;
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        logOptions = logOptions == null ? LogOptions.defaults() : logOptions;
        hooks = hooks == null ? PostRunHooks.none() : hooks;
    }

    public TaskDefinition withEnabled(boolean flag) {
        return new TaskDefinition(id, name, description, flag, priority, resourceGroup, triggers, retryPolicy,
                command, workingDirectory, environment, devicePrep, logOptions, hooks);
    }

    /** Trigger at the given key, or {@code null} when the key does not belong to this task. */
    public TriggerSpec trigger(TriggerKey key) {
        if (key == null || key.isManual() || !id.equals(key.taskId())
                || key.index() < 0 || key.index() >= triggers.size()) {
            return null;
        }
        return triggers.get(key.index());
    }

    /** Trigger type label of the first trigger, for summaries. */
    public String primaryTriggerType() {
        return triggers.isEmpty() ? "manual" : triggers.get(0).type().label();
    }
}
