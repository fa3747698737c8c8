package com.maascheduler.core.scheduler;

import com.maascheduler.core.TaskConflictException;
import com.maascheduler.core.executor.TaskExecutor;
import com.maascheduler.core.metrics.SchedulerMetrics;
import com.maascheduler.core.model.QueueItem;
import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.queue.TaskQueue;
import com.maascheduler.core.resource.ResourceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.maascheduler.core.model.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkerLoopTest {

    private final Map<String, TaskDefinition> catalog = new HashMap<>();
    private final List<QueueItem> dispatched = new CopyOnWriteArrayList<>();
    private final List<String> conflicting = new ArrayList<>();

    private TaskQueue queue;
    private ResourceManager resources;
    private TaskExecutor executor;
    private WorkerLoop loop;

    @BeforeEach
    void setUp() {
        queue = new TaskQueue();
        resources = new ResourceManager();
        resources.loadGroups(List.of(
                new ResourceGroup("emulator", "", 1),
                new ResourceGroup("default", "", 2)));
        executor = mock(TaskExecutor.class);
        loop = new WorkerLoop(queue, resources, executor, new SchedulerMetrics(new SimpleMeterRegistry()),
                catalog::get, item -> {
                    if (conflicting.contains(item.taskId())) {
                        throw new TaskConflictException("Task " + item.taskId() + " is already running");
                    }
                    dispatched.add(item);
                },
                Duration.ofMillis(10), Duration.ofMillis(10));
    }

    private TaskDefinition register(TaskDefinition task) {
        catalog.put(task.id(), task);
        return task;
    }

    @Test
    @DisplayName("dispatches admitted items in priority order and allocates their slots")
    void dispatchesInOrder() throws InterruptedException {
        queue.put(QueueItem.manual(register(task("low", 9, "default"))));
        queue.put(QueueItem.manual(register(task("high", 1, "emulator"))));

        loop.step();
        loop.step();

        assertEquals(List.of("high", "low"), dispatched.stream().map(QueueItem::taskId).toList());
        assertEquals(List.of("high"), resources.occupantsOf("emulator"));
        assertEquals(List.of("low"), resources.occupantsOf("default"));
    }

    @Test
    @DisplayName("a full group does not block items of other groups")
    void fullGroupDoesNotBlock() throws InterruptedException {
        assertTrue(resources.tryAllocate(register(task("busy", 5, "emulator"))));
        queue.put(QueueItem.manual(register(task("waiting", 1, "emulator"))));
        queue.put(QueueItem.manual(register(task("other", 5, "default"))));

        loop.step();
        loop.step();

        assertEquals(List.of("other"), dispatched.stream().map(QueueItem::taskId).toList());
        assertTrue(queue.hasDeferred());
        assertTrue(queue.contains("waiting"));

        loop.step();
        assertFalse(queue.hasDeferred());
        assertTrue(queue.contains("waiting"));

        resources.release(catalog.get("busy"));
        loop.step();
        assertEquals("waiting", dispatched.get(1).taskId());
    }

    @Test
    @DisplayName("a deferred item removed from the queue never runs")
    void removedWhileDeferred() throws InterruptedException {
        assertTrue(resources.tryAllocate(register(task("busy", 5, "emulator"))));
        queue.put(QueueItem.manual(register(task("waiting", 1, "emulator"))));
        loop.step();
        assertTrue(queue.contains("waiting"));

        assertEquals(1, queue.remove("waiting"));
        resources.release(catalog.get("busy"));
        loop.step();
        loop.step();

        assertTrue(dispatched.isEmpty());
        assertTrue(resources.occupantsOf("emulator").isEmpty());
    }

    @Test
    @DisplayName("items of a running task wait for it to finish")
    void runningTaskDeferred() throws InterruptedException {
        queue.put(QueueItem.manual(register(task("daily", 5, "default"))));
        when(executor.isRunning("daily")).thenReturn(true);

        loop.step();
        loop.step();

        assertTrue(dispatched.isEmpty());
        assertTrue(queue.contains("daily"));
        assertTrue(resources.occupantsOf("default").isEmpty());
    }

    @Test
    @DisplayName("items of deleted or disabled tasks are dropped")
    void dropsStaleItems() throws InterruptedException {
        TaskDefinition daily = task("daily", 5, "default");
        queue.put(QueueItem.manual(daily));
        queue.put(QueueItem.manual(register(task("off", 5, "default").withEnabled(false))));

        loop.step();
        loop.step();

        assertTrue(dispatched.isEmpty());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("dispatches the current definition rather than the enqueued snapshot")
    void refreshesSnapshot() throws InterruptedException {
        queue.put(QueueItem.manual(task("daily", 5, "default")));
        TaskDefinition current = register(task("daily", 2, "emulator"));

        loop.step();

        assertSame(current, dispatched.get(0).task());
        assertEquals(List.of("daily"), resources.occupantsOf("emulator"));
    }

    @Test
    @DisplayName("a dispatch conflict defers the item")
    void conflictDefers() throws InterruptedException {
        queue.put(QueueItem.manual(register(task("daily", 5, "default"))));
        conflicting.add("daily");

        loop.step();
        loop.step();

        assertTrue(dispatched.isEmpty());
        assertTrue(queue.contains("daily"));
    }

    @Test
    @DisplayName("the background thread consumes the queue until stopped")
    void backgroundThread() throws InterruptedException {
        loop.start();
        assertTrue(loop.isRunning());
        queue.put(QueueItem.manual(register(task("daily", 5, "default"))));

        long deadline = System.currentTimeMillis() + 5000;
        while (dispatched.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        loop.stop(Duration.ofSeconds(5));

        assertEquals(1, dispatched.size());
        assertFalse(loop.isRunning());
    }
}
