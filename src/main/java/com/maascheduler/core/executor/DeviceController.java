package com.maascheduler.core.executor;

import com.maascheduler.core.config.AppStateStore;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.model.DevicePrep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Runs adb pre-task steps for a device: connect, resolution change, wake and unlock, app launch.
 */
@Component
public class DeviceController {

    private static final Logger log = LoggerFactory.getLogger(DeviceController.class);

    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    private final ShellRunner shell;
    private final AppStateStore state;
    private final String adbPath;
    private final Duration wakeSettleDelay;
    private final Set<String> connectedDevices = ConcurrentHashMap.newKeySet();

    public DeviceController(ShellRunner shell, AppStateStore state, SchedulerProperties properties) {
        this.shell = shell;
        this.state = state;
        this.adbPath = properties.getDevice().getAdbPath();
        this.wakeSettleDelay = properties.getDevice().getWakeSettleDelay();
    }

    /**
     * Runs every configured step in order. The first failing step aborts the rest.
     *
     * @throws DevicePreparationException when a step fails
     * @throws InterruptedException       when the run is cancelled
     */
    public void prepare(DevicePrep prep, OutputListener listener) throws InterruptedException {
        ensureConnected(prep.deviceId(), listener);

        if (prep.resolution() != null && !prep.resolution().isBlank()) {
            ensureResolution(prep.deviceId(), prep.resolution(), listener);
        }

        if (!prep.wake()) {
            return;
        }

        log.info("Waking device {}", prep.deviceId());
        adbShell(prep.deviceId(), "input keyevent KEYCODE_WAKEUP", listener);
        Thread.sleep(wakeSettleDelay.toMillis());
        adbShell(prep.deviceId(), "input swipe 300 1000 300 500", listener);

        if (!prep.launchDelay().isZero()) {
            log.info("Waiting {}s before launching the app", prep.launchDelay().toSeconds());
            Thread.sleep(prep.launchDelay().toMillis());
        }

        if (prep.launchPackage() != null && !prep.launchPackage().isBlank()) {
            String command = launchCommand(prep.launchPackage(), prep.launchActivity());
            log.info("Launching app: {}", command);
            adbShell(prep.deviceId(), command, listener);
        }
    }

    /**
     * Connects to the device unless an earlier connect already succeeded.
     */
    public void ensureConnected(String deviceId, OutputListener listener) throws InterruptedException {
        if (connectedDevices.contains(deviceId)) {
            return;
        }
        log.info("Connecting to adb device {}", deviceId);
        CommandResult result = execute(quote(adbPath) + " connect " + quote(deviceId), listener);
        if (!result.success()) {
            throw new DevicePreparationException("adb connect %s failed (exit %d): %s"
                    .formatted(deviceId, result.exitCode(), result.stderr().strip()));
        }
        connectedDevices.add(deviceId);
    }

    void ensureResolution(String deviceId, String requested, OutputListener listener) throws InterruptedException {
        String target = normalizeResolution(requested);
        if (!target.contains("x")) {
            throw new DevicePreparationException("Invalid target resolution: " + requested);
        }
        String current = state.lastResolution(deviceId).orElse(null);
        if (target.equals(current)) {
            log.debug("Device {} already at {}", deviceId, target);
            return;
        }
        log.info("Changing resolution of {}: {} -> {}", deviceId, current == null ? "unknown" : current, target);
        adbShell(deviceId, "wm size " + target, listener);
        state.recordResolution(deviceId, target);
    }

    /** Forgets cached connections, forcing a reconnect on the next run. */
    public void resetConnections() {
        connectedDevices.clear();
    }

    static String normalizeResolution(String raw) {
        return raw.toLowerCase(Locale.ROOT).replace('×', 'x').replace(" ", "").strip();
    }

    static String launchCommand(String pkg, String activity) {
        if (activity != null && !activity.isBlank()) {
            String component = activity.contains("/") ? activity : pkg + "/" + activity;
            return "am start -n " + component;
        }
        return "monkey -p " + pkg + " -c android.intent.category.LAUNCHER 1";
    }

    static String quote(String value) {
        if (SHELL_SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    private void adbShell(String deviceId, String command, OutputListener listener) throws InterruptedException {
        ensureConnected(deviceId, listener);
        String fullCommand = quote(adbPath) + " -s " + quote(deviceId) + " shell " + command;
        CommandResult result = execute(fullCommand, listener);
        if (!result.success()) {
            throw new DevicePreparationException("adb command failed (exit %d): %s%n%s"
                    .formatted(result.exitCode(), fullCommand, result.stderr().strip()));
        }
    }

    private CommandResult execute(String commandLine, OutputListener listener) throws InterruptedException {
        try {
            return shell.run(ShellCommand.of(commandLine), listener);
        } catch (IOException e) {
            throw new DevicePreparationException("Cannot run '" + commandLine + "': " + e.getMessage(), e);
        }
    }
}
