package com.maascheduler.core.resource;

import com.maascheduler.core.model.ResourceGroup;
import com.maascheduler.core.model.ResourceGroupStatus;
import com.maascheduler.core.model.TaskDefinition;
import com.maascheduler.core.model.TaskFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ResourceManagerTest {

    private ResourceManager resources;

    @BeforeEach
    void setUp() {
        resources = new ResourceManager();
        resources.loadGroups(List.of(
                new ResourceGroup("emulator", "MuMu", 1),
                new ResourceGroup("pool", "two slots", 2)));
    }

    // -- Admission tests ------------------------------------------------------

    @Nested
    @DisplayName("admission")
    class AdmissionTests {

        @Test
        @DisplayName("a single-slot group admits one task at a time")
        void singleSlot() {
            TaskDefinition a = TaskFixtures.task("a", 1, "emulator");
            TaskDefinition b = TaskFixtures.task("b", 1, "emulator");

            assertTrue(resources.tryAllocate(a));
            assertFalse(resources.canStart(b));
            assertFalse(resources.tryAllocate(b));
            assertTrue(resources.isFull("emulator"));

            resources.release(a);
            assertTrue(resources.tryAllocate(b));
            assertEquals(List.of("b"), resources.occupantsOf("emulator"));
        }

        @Test
        @DisplayName("respects max_concurrent above one")
        void multiSlot() {
            assertTrue(resources.tryAllocate(TaskFixtures.task("a", 1, "pool")));
            assertTrue(resources.tryAllocate(TaskFixtures.task("b", 1, "pool")));
            assertFalse(resources.tryAllocate(TaskFixtures.task("c", 1, "pool")));
        }

        @Test
        @DisplayName("unknown groups are admitted without limit")
        void unknownGroupFailsOpen() {
            assertTrue(resources.tryAllocate(TaskFixtures.task("a", 1, "typo")));
            assertTrue(resources.tryAllocate(TaskFixtures.task("b", 1, "typo")));
            assertFalse(resources.isFull("typo"));
        }

        @Test
        @DisplayName("the default group always exists with one slot")
        void defaultGroup() {
            assertTrue(resources.status().stream().anyMatch(s -> s.name().equals(ResourceGroup.DEFAULT_GROUP)));
            assertTrue(resources.tryAllocate(TaskFixtures.task("a", 1)));
            assertFalse(resources.canStart(TaskFixtures.task("b", 1)));
        }
    }

    // -- Reload tests ---------------------------------------------------------

    @Nested
    @DisplayName("loadGroups")
    class ReloadTests {

        @Test
        @DisplayName("keeps occupancy of running tasks across a reload")
        void keepsOccupancy() {
            TaskDefinition a = TaskFixtures.task("a", 1, "emulator");
            resources.tryAllocate(a);

            resources.loadGroups(List.of(new ResourceGroup("emulator", "MuMu", 1)));

            assertFalse(resources.canStart(TaskFixtures.task("b", 1, "emulator")));
            resources.release(a);
            assertTrue(resources.canStart(TaskFixtures.task("b", 1, "emulator")));
        }
    }

    // -- Status tests ---------------------------------------------------------

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("reports running and available counts")
        void reportsCounts() {
            resources.tryAllocate(TaskFixtures.task("a", 1, "pool"));

            ResourceGroupStatus pool = resources.status().stream()
                    .filter(s -> s.name().equals("pool")).findFirst().orElseThrow();
            assertEquals(2, pool.maxConcurrent());
            assertEquals(1, pool.runningCount());
            assertEquals(1, pool.available());
            assertEquals(List.of("a"), pool.runningTasks());
        }
    }

    // -- Release signalling tests ---------------------------------------------

    @Nested
    @DisplayName("awaitRelease")
    class AwaitReleaseTests {

        @Test
        @DisplayName("times out when nothing is released")
        void timesOut() throws InterruptedException {
            assertFalse(resources.awaitRelease(Duration.ofMillis(20)));
        }

        @Test
        @DisplayName("wakes up on release")
        void wakesOnRelease() throws Exception {
            TaskDefinition a = TaskFixtures.task("a", 1, "emulator");
            resources.tryAllocate(a);
            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean woke = new AtomicBoolean();
            Thread waiter = new Thread(() -> {
                try {
                    started.countDown();
                    woke.set(resources.awaitRelease(Duration.ofSeconds(5)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();
            assertTrue(started.await(1, TimeUnit.SECONDS));
            Thread.sleep(50);

            resources.release(a);
            waiter.join(5000);

            assertTrue(woke.get());
        }
    }
}
