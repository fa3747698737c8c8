package com.maascheduler.core.trigger;

import com.maascheduler.core.model.TriggerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class TriggerEvaluatorTest {

    /** A Monday. */
    private static final LocalDateTime MONDAY_NOON = LocalDateTime.of(2026, 10, 19, 12, 0);

    private TriggerEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new TriggerEvaluator(new Random(42));
    }

    private static LocalTime t(int hour, int minute) {
        return LocalTime.of(hour, minute);
    }

    // -- Scheduled trigger tests ----------------------------------------------

    @Nested
    @DisplayName("scheduled")
    class ScheduledTests {

        @Test
        @DisplayName("fires at today's start when it is still ahead")
        void laterToday() {
            var trigger = new TriggerSpec.Scheduled(t(16, 5), t(18, 0));
            assertEquals(LocalDateTime.of(2026, 10, 19, 16, 5), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
        }

        @Test
        @DisplayName("rolls over to tomorrow once the start has passed")
        void tomorrow() {
            var trigger = new TriggerSpec.Scheduled(t(4, 5), t(6, 0));
            assertEquals(LocalDateTime.of(2026, 10, 20, 4, 5), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
        }

        @Test
        @DisplayName("start equal to now is not a future fire")
        void strictlyAfter() {
            var trigger = new TriggerSpec.Scheduled(t(12, 0), null);
            assertEquals(MONDAY_NOON.plusDays(1), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
        }

        @Test
        @DisplayName("window wrapping midnight is active late evening and early morning")
        void wrapsMidnight() {
            var trigger = new TriggerSpec.Scheduled(t(23, 0), t(4, 0));

            assertTrue(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 23, 30)));
            assertTrue(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 20, 3, 59)));
            assertFalse(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 20, 4, 0)));
            assertFalse(evaluator.isWindowActive(trigger, MONDAY_NOON));
        }

        @Test
        @DisplayName("window end is exclusive")
        void endExclusive() {
            var trigger = new TriggerSpec.Scheduled(t(4, 0), t(6, 0));

            assertTrue(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 4, 0)));
            assertTrue(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 5, 59)));
            assertFalse(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 6, 0)));
        }

        @Test
        @DisplayName("without an end only the start minute is active")
        void noEnd() {
            var trigger = new TriggerSpec.Scheduled(t(4, 0), null);

            assertTrue(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 4, 0, 45)));
            assertFalse(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 4, 1)));
        }

        @Test
        @DisplayName("start equal to end is active all day")
        void allDay() {
            var trigger = new TriggerSpec.Scheduled(t(4, 0), t(4, 0));
            assertTrue(evaluator.isWindowActive(trigger, MONDAY_NOON));
        }
    }

    // -- Interval trigger tests -----------------------------------------------

    @Nested
    @DisplayName("interval")
    class IntervalTests {

        @Test
        @DisplayName("first fire is immediate")
        void immediate() {
            assertEquals(MONDAY_NOON, evaluator.nextFireTime(new TriggerSpec.Interval(10), MONDAY_NOON).orElseThrow());
        }

        @Test
        @DisplayName("next fire is measured from completion")
        void fromCompletion() {
            LocalDateTime completed = MONDAY_NOON.plusMinutes(37);
            assertEquals(completed.plusMinutes(10),
                    evaluator.nextAfterCompletion(new TriggerSpec.Interval(10), completed));
        }

        @Test
        @DisplayName("interval triggers have no window")
        void noWindow() {
            assertFalse(evaluator.isWindowActive(new TriggerSpec.Interval(10), MONDAY_NOON));
        }
    }

    // -- Random trigger tests -------------------------------------------------

    @Nested
    @DisplayName("random_time")
    class RandomTimeTests {

        @Test
        @DisplayName("samples inside today's window when it is ahead")
        void insideWindow() {
            var trigger = new TriggerSpec.RandomTime(t(13, 0), t(14, 30));
            for (int i = 0; i < 50; i++) {
                LocalDateTime next = evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow();
                assertFalse(next.isBefore(LocalDateTime.of(2026, 10, 19, 13, 0)));
                assertFalse(next.isAfter(LocalDateTime.of(2026, 10, 19, 14, 30)));
            }
        }

        @Test
        @DisplayName("samples only the remainder when already inside the window")
        void remainder() {
            var trigger = new TriggerSpec.RandomTime(t(11, 0), t(13, 0));
            for (int i = 0; i < 50; i++) {
                LocalDateTime next = evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow();
                assertFalse(next.isBefore(MONDAY_NOON));
                assertFalse(next.isAfter(LocalDateTime.of(2026, 10, 19, 13, 0)));
            }
        }

        @Test
        @DisplayName("after a fire the next sample lands in the following day's window")
        void skipsFiredWindow() {
            var trigger = new TriggerSpec.RandomTime(t(13, 0), t(14, 30));
            LocalDateTime fired = LocalDateTime.of(2026, 10, 19, 13, 20);

            LocalDateTime next = evaluator.nextRandomAfterFire(trigger, fired);

            assertEquals(20, next.getDayOfMonth());
            assertFalse(next.toLocalTime().isBefore(t(13, 0)));
            assertFalse(next.toLocalTime().isAfter(t(14, 30)));
        }

        @Test
        @DisplayName("window bounds are inclusive")
        void inclusiveWindow() {
            var trigger = new TriggerSpec.RandomTime(t(13, 0), t(14, 30));

            assertTrue(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 14, 30)));
            assertFalse(evaluator.isWindowActive(trigger, LocalDateTime.of(2026, 10, 19, 14, 30, 1)));
        }
    }

    // -- Calendar trigger tests -----------------------------------------------

    @Nested
    @DisplayName("weekly and monthly")
    class CalendarTests {

        @Test
        @DisplayName("weekly picks the next listed weekday")
        void weekly() {
            var trigger = new TriggerSpec.Weekly(Set.of(DayOfWeek.MONDAY, DayOfWeek.THURSDAY), t(20, 0));

            assertEquals(LocalDateTime.of(2026, 10, 19, 20, 0), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
            assertEquals(LocalDateTime.of(2026, 10, 22, 20, 0),
                    evaluator.nextFireTime(trigger, LocalDateTime.of(2026, 10, 19, 20, 0)).orElseThrow());
        }

        @Test
        @DisplayName("weekly handles Sunday")
        void weeklySunday() {
            var trigger = new TriggerSpec.Weekly(Set.of(DayOfWeek.SUNDAY), t(9, 30));
            assertEquals(LocalDateTime.of(2026, 10, 25, 9, 30), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
        }

        @Test
        @DisplayName("monthly skips months without the requested day")
        void monthlySkipsShortMonths() {
            var trigger = new TriggerSpec.Monthly(new TreeSet<>(List.of(31)), t(8, 0));
            assertEquals(LocalDateTime.of(2026, 12, 31, 8, 0),
                    evaluator.nextFireTime(trigger, LocalDateTime.of(2026, 11, 5, 0, 0)).orElseThrow());
        }

        @Test
        @DisplayName("monthly picks the nearest listed day")
        void monthly() {
            var trigger = new TriggerSpec.Monthly(new TreeSet<>(List.of(1, 15)), t(8, 0));
            assertEquals(LocalDateTime.of(2026, 11, 1, 8, 0), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
        }
    }

    // -- Specific date tests --------------------------------------------------

    @Nested
    @DisplayName("specific_date")
    class SpecificDateTests {

        @Test
        @DisplayName("returns the earliest future date")
        void earliestFuture() {
            var trigger = new TriggerSpec.SpecificDate(List.of(
                    LocalDateTime.of(2026, 12, 1, 10, 0),
                    LocalDateTime.of(2026, 10, 1, 10, 0),
                    LocalDateTime.of(2026, 11, 1, 16, 10)));

            assertEquals(LocalDateTime.of(2026, 11, 1, 16, 10), evaluator.nextFireTime(trigger, MONDAY_NOON).orElseThrow());
        }

        @Test
        @DisplayName("is exhausted once every date has passed")
        void exhausted() {
            var trigger = new TriggerSpec.SpecificDate(List.of(LocalDateTime.of(2026, 10, 1, 10, 0)));
            assertTrue(evaluator.nextFireTime(trigger, MONDAY_NOON).isEmpty());
        }
    }
}
