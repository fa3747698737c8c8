package com.maascheduler.core.model;

import java.time.Duration;

/**
 * Device preparation steps run before the main command.
 *
 * @param deviceId       adb serial, e.g. {@code 127.0.0.1:16384}
 * @param resolution     target resolution such as {@code 1920x1080}, or {@code null} to leave it alone
 * @param wake           send wake and unlock key events
 * @param launchPackage  package to start after waking, or {@code null}
 * @param launchActivity activity to start, or {@code null} to use the launcher intent
 * @param launchDelay    pause between waking and launching
 */
public record DevicePrep(
        String deviceId,
        String resolution,
        boolean wake,
        String launchPackage,
        String launchActivity,
        Duration launchDelay
) {

    public DevicePrep {
        launchDelay = launchDelay == null || launchDelay.isNegative() ? Duration.ZERO : launchDelay;
    }

    public boolean hasDevice() {
        return deviceId != null && !deviceId.isBlank();
    }
}
