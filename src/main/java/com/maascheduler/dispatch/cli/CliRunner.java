package com.maascheduler.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final MaaSchedulerCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(MaaSchedulerCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the embedded web server owns the process lifetime.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    static boolean isServeMode(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
