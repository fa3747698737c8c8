package com.maascheduler.core.model;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A rule producing fire times for a task. The variants form a closed set; evaluation code
 * switches over {@link #type()} so that adding a variant breaks compilation where it is not handled.
 */
public sealed interface TriggerSpec {

    TriggerType type();

    /**
     * Fires daily at {@code start}. The window {@code [start, end)} may wrap past midnight.
     *
     * @param start daily start time
     * @param end   end of the window, or {@code null} when only the start minute counts as active
     */
    record Scheduled(LocalTime start, LocalTime end) implements TriggerSpec {
        public Scheduled {
            Objects.requireNonNull(start, "start");
        }

        @Override
        public TriggerType type() {
            return TriggerType.SCHEDULED;
        }
    }

    /**
     * Fires every {@code minutes} after the previous run completed; the first run fires immediately.
     */
    record Interval(int minutes) implements TriggerSpec {
        public Interval {
            if (minutes <= 0) {
                throw new IllegalArgumentException("Interval minutes must be positive: " + minutes);
            }
        }

        @Override
        public TriggerType type() {
            return TriggerType.INTERVAL;
        }
    }

    /**
     * Fires once a day at a uniformly random instant inside {@code [windowStart, windowEnd]}.
     */
    record RandomTime(LocalTime windowStart, LocalTime windowEnd) implements TriggerSpec {
        public RandomTime {
            Objects.requireNonNull(windowStart, "windowStart");
            Objects.requireNonNull(windowEnd, "windowEnd");
        }

        @Override
        public TriggerType type() {
            return TriggerType.RANDOM_TIME;
        }
    }

    record Weekly(Set<DayOfWeek> days, LocalTime time) implements TriggerSpec {
        public Weekly {
            Objects.requireNonNull(time, "time");
            if (days == null || days.isEmpty()) {
                throw new IllegalArgumentException("Weekly trigger needs at least one day");
            }
            days = Set.copyOf(days);
        }

        @Override
        public TriggerType type() {
            return TriggerType.WEEKLY;
        }
    }

    record Monthly(SortedSet<Integer> days, LocalTime time) implements TriggerSpec {
        public Monthly {
            Objects.requireNonNull(time, "time");
            if (days == null || days.isEmpty()) {
                throw new IllegalArgumentException("Monthly trigger needs at least one day");
            }
            for (Integer day : days) {
                if (day < 1 || day > 31) {
                    throw new IllegalArgumentException("Day of month out of range: " + day);
                }
            }
            days = new TreeSet<>(days);
        }

        @Override
        public TriggerType type() {
            return TriggerType.MONTHLY;
        }
    }

    /**
     * Fires once at each listed date-time. Dates in the past are ignored.
     */
    record SpecificDate(List<LocalDateTime> dates) implements TriggerSpec {
        public SpecificDate {
            dates = dates == null ? List.of() : dates.stream().sorted().toList();
        }

        @Override
        public TriggerType type() {
            return TriggerType.SPECIFIC_DATE;
        }
    }

    /**
     * Catalog entry that failed to parse. It keeps its position so that the keys of the
     * following triggers match their catalog index, and it never fires.
     */
    record Invalid(String reason) implements TriggerSpec {
        public Invalid {
            reason = reason == null ? "" : reason;
        }

        @Override
        public TriggerType type() {
            return TriggerType.INVALID;
        }
    }
}
