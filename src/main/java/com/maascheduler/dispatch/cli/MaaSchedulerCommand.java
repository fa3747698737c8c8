package com.maascheduler.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "maa-scheduler",
        mixinStandardHelpOptions = true,
        version = "MAA Scheduler 0.1.0",
        description = "Priority scheduler for MAA automation tasks",
        subcommands = {
                ServeCommand.class,
                ControlCommand.class,
                StatusCommand.class,
                RunCommand.class,
                CancelCommand.class,
                ModeCommand.class,
                LogCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                CheckConfigCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MaaSchedulerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
