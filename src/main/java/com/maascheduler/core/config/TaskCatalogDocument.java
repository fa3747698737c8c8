package com.maascheduler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Raw shape of the YAML task catalog, before validation and conversion into domain records.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskCatalogDocument(
        @JsonProperty("resource_groups") List<GroupEntry> resourceGroups,
        @JsonProperty("tasks") List<TaskEntry> tasks
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroupEntry(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("max_concurrent") Integer maxConcurrent
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskEntry(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("resource_group") String resourceGroup,
            @JsonProperty("main_command") String mainCommand,
            @JsonProperty("working_directory") String workingDirectory,
            @JsonProperty("environment") Map<String, String> environment,
            @JsonProperty("triggers") List<TriggerEntry> triggers,
            @JsonProperty("trigger") TriggerEntry trigger,
            @JsonProperty("retry_policy") RetryEntry retryPolicy,
            @JsonProperty("device") DeviceEntry device,
            @JsonProperty("logging") LoggingEntry logging,
            @JsonProperty("post_task") PostTaskEntry postTask
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TriggerEntry(
            @JsonProperty("trigger_type") String triggerType,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime,
            @JsonProperty("interval_minutes") Integer intervalMinutes,
            @JsonProperty("random_start_time") String randomStartTime,
            @JsonProperty("random_end_time") String randomEndTime,
            @JsonProperty("days_of_week") List<Integer> daysOfWeek,
            @JsonProperty("days_of_month") List<Integer> daysOfMonth,
            @JsonProperty("time") String time,
            @JsonProperty("specific_dates") List<String> specificDates
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryEntry(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("delay_seconds") Integer delaySeconds,
            @JsonProperty("notify_after_retries") Integer notifyAfterRetries,
            @JsonProperty("rerun_pre_tasks") Boolean rerunPreTasks,
            @JsonProperty("retry_on_success_within_window") Boolean retryOnSuccessWithinWindow,
            @JsonProperty("success_retry_delay_seconds") Integer successRetryDelaySeconds,
            @JsonProperty("success_retry_max") Integer successRetryMax
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeviceEntry(
            @JsonProperty("device_id") String deviceId,
            @JsonProperty("resolution") String resolution,
            @JsonProperty("wake") Boolean wake,
            @JsonProperty("launch_package") String launchPackage,
            @JsonProperty("launch_activity") String launchActivity,
            @JsonProperty("launch_delay_seconds") Integer launchDelaySeconds
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LoggingEntry(
            @JsonProperty("log_to_global") Boolean logToGlobal,
            @JsonProperty("temp_log") Boolean tempLog
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PostTaskEntry(
            @JsonProperty("notify_on_success") Boolean notifyOnSuccess,
            @JsonProperty("notify_on_failure") Boolean notifyOnFailure,
            @JsonProperty("title") String title,
            @JsonProperty("content") String content,
            @JsonProperty("log_keywords") List<String> logKeywords,
            @JsonProperty("keyword_notification") KeywordEntry keywordNotification
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KeywordEntry(
            @JsonProperty("title") String title,
            @JsonProperty("content") String content,
            @JsonProperty("tag") String tag
    ) {}
}
