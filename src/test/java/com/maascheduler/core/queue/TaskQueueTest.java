package com.maascheduler.core.queue;

import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.TaskFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    private TaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new TaskQueue();
    }

    private static QueueItem item(String id, int priority) {
        return QueueItem.manual(TaskFixtures.task(id, priority));
    }

    private List<String> drain() {
        return queue.snapshot().stream().map(QueueItem::taskId).toList();
    }

    // -- Ordering tests -------------------------------------------------------

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("dequeues by ascending priority")
        void ascendingPriority() {
            queue.put(item("a", 5));
            queue.put(item("b", 1));
            queue.put(item("c", 3));
            queue.put(item("d", 1));

            assertEquals("b", queue.get().orElseThrow().taskId());
            assertEquals("d", queue.get().orElseThrow().taskId());
            assertEquals("c", queue.get().orElseThrow().taskId());
            assertEquals("a", queue.get().orElseThrow().taskId());
            assertTrue(queue.get().isEmpty());
        }

        @Test
        @DisplayName("equal priorities keep insertion order")
        void fifoWithinPriority() {
            queue.put(item("first", 2));
            queue.put(item("second", 2));
            queue.put(item("urgent", 0));
            queue.put(item("third", 2));

            assertEquals(List.of("urgent", "first", "second", "third"), drain());
        }

        @Test
        @DisplayName("putAll inserts each item by priority")
        void putAll() {
            queue.put(item("x", 4));
            queue.putAll(List.of(item("y", 9), item("z", 1)));

            assertEquals(List.of("z", "x", "y"), drain());
        }
    }

    // -- Removal tests --------------------------------------------------------

    @Nested
    @DisplayName("removal")
    class RemovalTests {

        @Test
        @DisplayName("remove drops every item of one task")
        void removeTask() {
            queue.put(item("a", 1));
            queue.put(item("b", 1));
            queue.put(item("a", 2));

            assertEquals(2, queue.remove("a"));
            assertEquals(List.of("b"), drain());
            assertFalse(queue.contains("a"));
        }

        @Test
        @DisplayName("retain keeps only valid task ids")
        void retain() {
            queue.put(item("a", 1));
            queue.put(item("b", 1));
            queue.put(item("c", 1));

            assertEquals(1, queue.retain(Set.of("a", "c")));
            assertEquals(List.of("a", "c"), drain());
        }

        @Test
        @DisplayName("clear reports the discarded count")
        void clear() {
            queue.put(item("a", 1));
            queue.put(item("b", 1));

            assertEquals(2, queue.clear());
            assertTrue(queue.isEmpty());
        }
    }

    // -- Deferral tests -------------------------------------------------------

    @Nested
    @DisplayName("deferral")
    class DeferralTests {

        @Test
        @DisplayName("a deferred item stays pending but is hidden from poll")
        void deferredHiddenFromPoll() throws InterruptedException {
            queue.put(item("busy", 1));
            QueueItem taken = queue.poll(10, TimeUnit.MILLISECONDS).orElseThrow();

            assertTrue(queue.defer(taken));

            assertTrue(queue.contains("busy"));
            assertEquals(1, queue.size());
            assertEquals(List.of("busy"), drain());
            assertTrue(queue.poll(10, TimeUnit.MILLISECONDS).isEmpty());

            queue.restoreDeferred();
            assertFalse(queue.hasDeferred());
            assertEquals("busy", queue.get().orElseThrow().taskId());
        }

        @Test
        @DisplayName("remove and clear reach deferred items")
        void purgeReachesDeferred() {
            queue.put(item("a", 1));
            queue.put(item("b", 2));
            queue.defer(queue.get().orElseThrow());

            assertEquals(1, queue.remove("a"));
            assertFalse(queue.contains("a"));
            assertFalse(queue.hasDeferred());

            queue.defer(queue.get().orElseThrow());
            assertEquals(1, queue.clear());
            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("an item purged while taken is neither dispatched nor deferred")
        void purgedWhileTaken() {
            queue.put(item("a", 1));
            QueueItem taken = queue.get().orElseThrow();

            assertTrue(queue.contains("a"));
            assertEquals(1, queue.remove("a"));
            assertFalse(queue.contains("a"));
            assertFalse(queue.settle());

            queue.put(item("a", 1));
            queue.get();
            queue.retain(Set.of());
            assertFalse(queue.defer(taken));
            assertFalse(queue.hasDeferred());
        }

        @Test
        @DisplayName("a settled item is no longer tracked")
        void settled() {
            queue.put(item("a", 1));
            queue.get();

            assertTrue(queue.settle());
            assertEquals(0, queue.remove("a"));
        }

        @Test
        @DisplayName("a new arrival is ordered against deferred items")
        void putRestoresDeferred() {
            queue.put(item("urgent", 1));
            queue.defer(queue.get().orElseThrow());

            queue.put(item("routine", 9));

            assertFalse(queue.hasDeferred());
            assertEquals("urgent", queue.get().orElseThrow().taskId());
        }
    }

    // -- Blocking tests -------------------------------------------------------

    @Nested
    @DisplayName("poll")
    class PollTests {

        @Test
        @DisplayName("returns empty after the timeout")
        void timesOut() throws InterruptedException {
            assertTrue(queue.poll(20, TimeUnit.MILLISECONDS).isEmpty());
        }

        @Test
        @DisplayName("wakes up when an item is put")
        void wakesOnPut() throws Exception {
            CountDownLatch waiting = new CountDownLatch(1);
            AtomicReference<Optional<QueueItem>> result = new AtomicReference<>();
            Thread consumer = new Thread(() -> {
                try {
                    waiting.countDown();
                    result.set(queue.poll(5, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            consumer.start();
            assertTrue(waiting.await(1, TimeUnit.SECONDS));

            queue.put(item("late", 1));
            consumer.join(5000);

            assertEquals("late", result.get().orElseThrow().taskId());
        }
    }
}
