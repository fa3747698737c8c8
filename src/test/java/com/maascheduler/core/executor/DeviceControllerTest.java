package com.maascheduler.core.executor;

import com.maascheduler.core.config.AppStateStore;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.model.DevicePrep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class DeviceControllerTest {

    private static final String DEVICE = "127.0.0.1:16384";

    @TempDir
    Path tempDir;

    private final List<String> commands = new CopyOnWriteArrayList<>();
    private volatile int failOn = -1;
    private AppStateStore state;
    private DeviceController controller;

    @BeforeEach
    void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getDevice().setWakeSettleDelay(Duration.ZERO);
        state = new AppStateStore(tempDir.resolve("state.json"));
        ShellRunner shell = (command, listener) -> {
            commands.add(command.commandLine());
            int exit = commands.size() - 1 == failOn ? 1 : 0;
            return new CommandResult(exit, "", exit == 0 ? "" : "device offline");
        };
        controller = new DeviceController(shell, state, properties);
    }

    // -- Preparation tests ----------------------------------------------------

    @Nested
    @DisplayName("prepare")
    class PrepareTests {

        @Test
        @DisplayName("runs connect, resolution, wake, unlock and launch in order")
        void fullSequence() throws InterruptedException {
            controller.prepare(new DevicePrep(DEVICE, "1920x1080", true, "com.hypergryph.arknights", null,
                    Duration.ZERO), OutputListener.NONE);

            assertEquals(List.of(
                    "adb connect 127.0.0.1:16384",
                    "adb -s 127.0.0.1:16384 shell wm size 1920x1080",
                    "adb -s 127.0.0.1:16384 shell input keyevent KEYCODE_WAKEUP",
                    "adb -s 127.0.0.1:16384 shell input swipe 300 1000 300 500",
                    "adb -s 127.0.0.1:16384 shell monkey -p com.hypergryph.arknights -c android.intent.category.LAUNCHER 1"
            ), commands);
            assertEquals("1920x1080", state.lastResolution(DEVICE).orElseThrow());
        }

        @Test
        @DisplayName("skips the resolution change when already applied")
        void resolutionCached() throws InterruptedException {
            state.recordResolution(DEVICE, "1920x1080");

            controller.prepare(new DevicePrep(DEVICE, "1920 × 1080", false, null, null, null), OutputListener.NONE);

            assertEquals(List.of("adb connect 127.0.0.1:16384"), commands);
        }

        @Test
        @DisplayName("connects only once per device")
        void connectOnce() throws InterruptedException {
            controller.ensureConnected(DEVICE, OutputListener.NONE);
            controller.ensureConnected(DEVICE, OutputListener.NONE);
            assertEquals(1, commands.size());

            controller.resetConnections();
            controller.ensureConnected(DEVICE, OutputListener.NONE);
            assertEquals(2, commands.size());
        }

        @Test
        @DisplayName("a failing step aborts the remaining steps")
        void failureAborts() {
            failOn = 1;

            var e = assertThrows(DevicePreparationException.class, () -> controller.prepare(
                    new DevicePrep(DEVICE, null, true, "pkg", null, null), OutputListener.NONE));

            assertTrue(e.getMessage().contains("device offline"));
            assertEquals(2, commands.size());
        }

        @Test
        @DisplayName("rejects a malformed resolution")
        void badResolution() {
            assertThrows(DevicePreparationException.class, () -> controller.prepare(
                    new DevicePrep(DEVICE, "fullhd", false, null, null, null), OutputListener.NONE));
        }
    }

    // -- Helper tests ---------------------------------------------------------

    @Nested
    @DisplayName("helpers")
    class HelperTests {

        @Test
        @DisplayName("launchCommand prefers an explicit activity")
        void launchCommand() {
            assertEquals("am start -n pkg/.Main", DeviceController.launchCommand("pkg", ".Main"));
            assertEquals("am start -n other/.Main", DeviceController.launchCommand("pkg", "other/.Main"));
            assertEquals("monkey -p pkg -c android.intent.category.LAUNCHER 1",
                    DeviceController.launchCommand("pkg", " "));
        }

        @Test
        @DisplayName("quote leaves safe tokens alone and single-quotes the rest")
        void quote() {
            assertEquals("127.0.0.1:5555", DeviceController.quote("127.0.0.1:5555"));
            assertEquals("'/opt/Android SDK/adb'", DeviceController.quote("/opt/Android SDK/adb"));
        }
    }
}
