package com.maascheduler.core.executor;

import java.nio.file.Path;
import java.util.Map;

/**
 * A command line to run through the shell.
 *
 * @param commandLine      shell command line, passed to {@code /bin/sh -c}
 * @param workingDirectory working directory, or {@code null} to inherit
 * @param environment      variables added to the inherited environment
 */
public record ShellCommand(String commandLine, Path workingDirectory, Map<String, String> environment) {

    public ShellCommand {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static ShellCommand of(String commandLine) {
        return new ShellCommand(commandLine, null, Map.of());
    }
}
