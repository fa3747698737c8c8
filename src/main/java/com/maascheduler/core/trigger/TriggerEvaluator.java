package com.maascheduler.core.trigger;

import com.maascheduler.core.model.TriggerSpec;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import java.util.Random;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

/**
 * Computes fire times and window activity for {@link TriggerSpec} variants.
 * <p>
 * Stateless apart from the random source used by {@code random_time} triggers; all methods take
 * the reference time explicitly so callers control the clock.
 */
@Component
public class TriggerEvaluator {

    private final RandomGenerator random;

    public TriggerEvaluator() {
        this(new Random());
    }

    public TriggerEvaluator(RandomGenerator random) {
        this.random = random;
    }

    /**
     * Next time the trigger should fire, strictly after {@code now} for calendar triggers.
     * An interval trigger fires immediately on first arming, so its result is {@code now}.
     *
     * @return the fire time, or empty when the trigger will never fire again
     */
    public Optional<LocalDateTime> nextFireTime(TriggerSpec trigger, LocalDateTime now) {
        return switch (trigger.type()) {
            case SCHEDULED -> Optional.of(nextDaily(((TriggerSpec.Scheduled) trigger).start(), now));
            case INTERVAL -> Optional.of(now);
            case RANDOM_TIME -> Optional.of(sampleRandom((TriggerSpec.RandomTime) trigger, now));
            case WEEKLY -> nextCron(weeklyCron((TriggerSpec.Weekly) trigger), now);
            case MONTHLY -> nextCron(monthlyCron((TriggerSpec.Monthly) trigger), now);
            case SPECIFIC_DATE -> ((TriggerSpec.SpecificDate) trigger).dates().stream()
                    .filter(date -> date.isAfter(now))
                    .findFirst();
            case INVALID -> Optional.empty();
        };
    }

    /**
     * Next interval fire, measured from when the previous run completed.
     */
    public LocalDateTime nextAfterCompletion(TriggerSpec.Interval trigger, LocalDateTime completedAt) {
        return completedAt.plusMinutes(trigger.minutes());
    }

    /**
     * Next random instant after a fire at {@code firedAt}. The window that contained the fire is
     * skipped so a trigger fires at most once per window.
     */
    public LocalDateTime nextRandomAfterFire(TriggerSpec.RandomTime trigger, LocalDateTime firedAt) {
        LocalDateTime windowEnd = nextDailyInclusive(trigger.windowEnd(), firedAt);
        return sampleRandom(trigger, windowEnd.plusSeconds(1));
    }

    /**
     * Whether the trigger's daily window contains {@code now}.
     * <p>
     * For {@code scheduled} triggers the window is {@code [start, end)}, wrapping past midnight when
     * {@code end < start}. Without an end only the start minute is active; {@code start == end}
     * means active all day. {@code random_time} windows are inclusive. Other trigger types have no
     * window and are never active.
     */
    public boolean isWindowActive(TriggerSpec trigger, LocalDateTime now) {
        LocalTime time = now.toLocalTime();
        if (trigger instanceof TriggerSpec.Scheduled scheduled) {
            LocalTime start = scheduled.start();
            LocalTime end = scheduled.end();
            if (end == null) {
                return time.getHour() == start.getHour() && time.getMinute() == start.getMinute();
            }
            if (start.equals(end)) {
                return true;
            }
            if (start.isBefore(end)) {
                return !time.isBefore(start) && time.isBefore(end);
            }
            return !time.isBefore(start) || time.isBefore(end);
        }
        if (trigger instanceof TriggerSpec.RandomTime randomTime) {
            LocalTime start = randomTime.windowStart();
            LocalTime end = randomTime.windowEnd();
            if (start.isBefore(end)) {
                return !time.isBefore(start) && !time.isAfter(end);
            }
            return !time.isBefore(start) || !time.isAfter(end);
        }
        return false;
    }

    // -- Helpers --------------------------------------------------------------

    private LocalDateTime sampleRandom(TriggerSpec.RandomTime trigger, LocalDateTime now) {
        LocalDateTime start = now.toLocalDate().atTime(trigger.windowStart());
        LocalDateTime end = now.toLocalDate().atTime(trigger.windowEnd());
        if (!end.isAfter(start)) {
            end = end.plusDays(1);
        }
        if (now.isAfter(end)) {
            start = start.plusDays(1);
            end = end.plusDays(1);
        }
        LocalDateTime effectiveStart = now.isAfter(start) ? now : start;
        if (!effectiveStart.isBefore(end)) {
            start = start.plusDays(1);
            end = end.plusDays(1);
            effectiveStart = start;
        }
        long spanSeconds = Duration.between(effectiveStart, end).getSeconds();
        long offset = spanSeconds <= 0 ? 0 : random.nextLong(spanSeconds + 1);
        return effectiveStart.plusSeconds(offset);
    }

    static LocalDateTime nextDaily(LocalTime time, LocalDateTime now) {
        LocalDateTime candidate = now.toLocalDate().atTime(time);
        return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
    }

    private static LocalDateTime nextDailyInclusive(LocalTime time, LocalDateTime now) {
        LocalDateTime candidate = now.toLocalDate().atTime(time);
        return candidate.isBefore(now) ? candidate.plusDays(1) : candidate;
    }

    private static Optional<LocalDateTime> nextCron(String expression, LocalDateTime now) {
        return Optional.ofNullable(CronExpression.parse(expression).next(now));
    }

    static String weeklyCron(TriggerSpec.Weekly trigger) {
        String days = trigger.days().stream()
                .sorted()
                .map(DayOfWeek::getValue)
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        return cronPrefix(trigger.time()) + " * * " + days;
    }

    static String monthlyCron(TriggerSpec.Monthly trigger) {
        String days = trigger.days().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        return cronPrefix(trigger.time()) + " " + days + " * *";
    }

    private static String cronPrefix(LocalTime time) {
        return time.getSecond() + " " + time.getMinute() + " " + time.getHour();
    }
}
