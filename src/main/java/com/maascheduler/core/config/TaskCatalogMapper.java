package com.maascheduler.core.config;

import com.maascheduler.core.config.TaskCatalogDocument.GroupEntry;
import com.maascheduler.core.config.TaskCatalogDocument.TaskEntry;
import com.maascheduler.core.config.TaskCatalogDocument.TriggerEntry;
import com.maascheduler.core.model.DevicePrep;
import com.maascheduler.core.model.LogOptions;
import com.maascheduler.core.model.PostRunHooks;
import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.RetryPolicy;
import com.maascheduler.core.model.SuccessRepeatPolicy;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TriggerSpec;
import com.maascheduler.core.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts a {@link TaskCatalogDocument} into domain records.
 * <p>
 * A malformed trigger is logged and dropped while the rest of its task still loads. A task entry
 * without an id or command is dropped entirely.
 */
public class TaskCatalogMapper {

    private static final Logger log = LoggerFactory.getLogger(TaskCatalogMapper.class);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    private static final int DEFAULT_PRIORITY = 5;

    public List<ResourceGroup> toGroups(TaskCatalogDocument document) {
        List<ResourceGroup> groups = new ArrayList<>();
        if (document.resourceGroups() == null) {
            return groups;
        }
        for (GroupEntry entry : document.resourceGroups()) {
            if (entry == null || entry.name() == null || entry.name().isBlank()) {
                log.error("Skipping resource group without a name");
                continue;
            }
            groups.add(new ResourceGroup(entry.name(), entry.description(),
                    entry.maxConcurrent() == null ? 1 : entry.maxConcurrent()));
        }
        return groups;
    }

    public List<TaskDefinition> toTasks(TaskCatalogDocument document) {
        List<TaskDefinition> tasks = new ArrayList<>();
        if (document.tasks() == null) {
            return tasks;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (TaskEntry entry : document.tasks()) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                log.error("Skipping task entry without an id");
                continue;
            }
            if (entry.mainCommand() == null || entry.mainCommand().isBlank()) {
                log.error("Skipping task {}: main_command is missing", entry.id());
                continue;
            }
            if (!seen.add(entry.id())) {
                log.error("Skipping duplicate task id {}", entry.id());
                continue;
            }
            tasks.add(toTask(entry));
        }
        return tasks;
    }

    TaskDefinition toTask(TaskEntry entry) {
        List<TriggerEntry> rawTriggers = new ArrayList<>();
        if (entry.triggers() != null && !entry.triggers().isEmpty()) {
            rawTriggers.addAll(entry.triggers());
        } else if (entry.trigger() != null) {
            rawTriggers.add(entry.trigger());
        }

        List<TriggerSpec> triggers = new ArrayList<>();
        for (int i = 0; i < rawTriggers.size(); i++) {
            try {
                triggers.add(parseTrigger(rawTriggers.get(i)));
            } catch (TriggerFormatException e) {
                log.error("Task {} trigger #{} skipped: {}", entry.id(), i, e.getMessage());
                triggers.add(new TriggerSpec.Invalid(e.getMessage()));
            }
        }

        return new TaskDefinition(
                entry.id(),
                entry.name(),
                entry.description(),
                entry.enabled() == null || entry.enabled(),
                entry.priority() == null ? DEFAULT_PRIORITY : entry.priority(),
                entry.resourceGroup(),
                triggers,
                toRetryPolicy(entry.retryPolicy()),
                entry.mainCommand(),
                entry.workingDirectory(),
                entry.environment(),
                toDevicePrep(entry.device()),
                entry.logging() == null ? LogOptions.defaults() : new LogOptions(
                        flag(entry.logging().logToGlobal(), true),
                        flag(entry.logging().tempLog(), false)),
                toHooks(entry.postTask()));
    }

    /**
     * Parses one trigger entry.
     *
     * @throws TriggerFormatException when the type is unknown or a required field is missing or malformed
     */
    public TriggerSpec parseTrigger(TriggerEntry entry) {
        if (entry == null) {
            throw new TriggerFormatException("empty trigger entry");
        }
        TriggerType type;
        try {
            type = TriggerType.fromLabel(entry.triggerType());
        } catch (IllegalArgumentException e) {
            throw new TriggerFormatException(e.getMessage(), e);
        }

        try {
            return switch (type) {
                case SCHEDULED -> new TriggerSpec.Scheduled(
                        parseTime(required(entry.startTime(), "start_time")),
                        entry.endTime() == null || entry.endTime().isBlank() ? null : parseTime(entry.endTime()));
                case INTERVAL -> {
                    int minutes = entry.intervalMinutes() == null ? 0 : entry.intervalMinutes();
                    if (minutes <= 0) {
                        log.warn("interval_minutes must be positive (got {}), using 1", entry.intervalMinutes());
                        minutes = 1;
                    }
                    yield new TriggerSpec.Interval(minutes);
                }
                case RANDOM_TIME -> new TriggerSpec.RandomTime(
                        parseTime(required(firstNonBlank(entry.randomStartTime(), entry.startTime()),
                                "random_start_time")),
                        parseTime(required(firstNonBlank(entry.randomEndTime(), entry.endTime()),
                                "random_end_time")));
                case WEEKLY -> new TriggerSpec.Weekly(toDaysOfWeek(entry.daysOfWeek()),
                        parseTime(required(firstNonBlank(entry.time(), entry.startTime()), "time")));
                case MONTHLY -> new TriggerSpec.Monthly(toDaysOfMonth(entry.daysOfMonth()),
                        parseTime(required(firstNonBlank(entry.time(), entry.startTime()), "time")));
                case SPECIFIC_DATE -> new TriggerSpec.SpecificDate(toDates(entry.specificDates()));
                case INVALID -> throw new TriggerFormatException("Unknown trigger type: " + entry.triggerType());
            };
        } catch (IllegalArgumentException e) {
            throw new TriggerFormatException(type.label() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses {@code HH:MM} or {@code HH:MM:SS}.
     *
     * @throws TriggerFormatException for anything else
     */
    public static LocalTime parseTime(String value) {
        String[] parts = value.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new TriggerFormatException("time must be HH:MM, got '" + value + "'");
        }
        try {
            int hour = Integer.parseInt(parts[0]);
            int minute = Integer.parseInt(parts[1]);
            int second = parts.length == 3 ? Integer.parseInt(parts[2]) : 0;
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || second < 0 || second > 59) {
                throw new TriggerFormatException("time out of range: '" + value + "'");
            }
            return LocalTime.of(hour, minute, second);
        } catch (NumberFormatException e) {
            throw new TriggerFormatException("time must be HH:MM, got '" + value + "'", e);
        }
    }

    /**
     * Parses {@code yyyy-MM-dd HH:mm[:ss]}, with {@code T} accepted as the separator.
     *
     * @throws TriggerFormatException when no format matches
     */
    public static LocalDateTime parseDateTime(String value) {
        String normalized = value.trim().replace('T', ' ');
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDateTime.parse(normalized, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return LocalDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new TriggerFormatException("unrecognised date-time '" + value + "'", e);
        }
    }

    // -- Helpers --------------------------------------------------------------

    private static List<LocalDateTime> toDates(List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new TriggerFormatException("specific_dates is empty");
        }
        List<LocalDateTime> dates = new ArrayList<>();
        for (String value : values) {
            try {
                dates.add(parseDateTime(value));
            } catch (TriggerFormatException e) {
                log.error("Ignoring specific date: {}", e.getMessage());
            }
        }
        if (dates.isEmpty()) {
            throw new TriggerFormatException("no valid entries in specific_dates");
        }
        return dates;
    }

    /** Days are numbered 0 (Monday) to 6 (Sunday). */
    private static Set<DayOfWeek> toDaysOfWeek(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            throw new TriggerFormatException("days_of_week is empty");
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (Integer value : values) {
            if (value == null || value < 0 || value > 6) {
                throw new TriggerFormatException("day of week must be 0-6, got " + value);
            }
            days.add(DayOfWeek.of(value + 1));
        }
        return days;
    }

    private static TreeSet<Integer> toDaysOfMonth(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            throw new TriggerFormatException("days_of_month is empty");
        }
        return new TreeSet<>(values);
    }

    private static RetryPolicy toRetryPolicy(TaskCatalogDocument.RetryEntry entry) {
        if (entry == null) {
            return RetryPolicy.disabled();
        }
        SuccessRepeatPolicy repeat = new SuccessRepeatPolicy(
                flag(entry.retryOnSuccessWithinWindow(), false),
                seconds(entry.successRetryDelaySeconds(), 60),
                entry.successRetryMax());
        return new RetryPolicy(
                flag(entry.enabled(), false),
                entry.maxRetries() == null ? 0 : entry.maxRetries(),
                seconds(entry.delaySeconds(), 60),
                entry.notifyAfterRetries(),
                flag(entry.rerunPreTasks(), true),
                repeat);
    }

    private static DevicePrep toDevicePrep(TaskCatalogDocument.DeviceEntry entry) {
        if (entry == null || entry.deviceId() == null || entry.deviceId().isBlank()) {
            return null;
        }
        return new DevicePrep(entry.deviceId(), entry.resolution(), flag(entry.wake(), false),
                entry.launchPackage(), entry.launchActivity(), seconds(entry.launchDelaySeconds(), 0));
    }

    private static PostRunHooks toHooks(TaskCatalogDocument.PostTaskEntry entry) {
        if (entry == null) {
            return PostRunHooks.none();
        }
        TaskCatalogDocument.KeywordEntry keyword = entry.keywordNotification();
        return new PostRunHooks(
                flag(entry.notifyOnSuccess(), false),
                flag(entry.notifyOnFailure(), false),
                entry.title(),
                entry.content(),
                entry.logKeywords(),
                keyword == null ? null : keyword.title(),
                keyword == null ? null : keyword.content(),
                keyword == null ? null : keyword.tag());
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new TriggerFormatException(field + " is required");
        }
        return value;
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    private static boolean flag(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static Duration seconds(Integer value, int fallback) {
        return Duration.ofSeconds(value == null ? fallback : value);
    }
}
