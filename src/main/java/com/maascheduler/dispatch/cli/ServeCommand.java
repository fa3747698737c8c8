package com.maascheduler.dispatch.cli;

import com.maascheduler.core.SchedulerException;
import com.maascheduler.core.config.SchedulerProperties;
import com.maascheduler.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: maa-scheduler serve
 * <p>
 * Starts the scheduler as a long-running HTTP server exposing the REST API and the SSE event stream.
 * The web server is enabled by {@link com.maascheduler.MaaSchedulerApplication#main} detecting "serve"
 * in args, and {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Once the server is ready the banner is printed and, when {@code maa.scheduler.auto-start} is set,
 * the scheduler is started.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the scheduler HTTP server")
@Component
public class ServeCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Value("${server.port:8080}")
    private int port;

    private final TaskScheduler scheduler;
    private final SchedulerProperties properties;

    public ServeCommand(TaskScheduler scheduler, SchedulerProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
        if (!properties.getScheduler().isAutoStart()) {
            ConsoleOutput.info("Auto-start disabled, use 'maa-scheduler control start' to begin scheduling.");
            return;
        }
        try {
            scheduler.start();
            ConsoleOutput.success("Scheduler started in " + scheduler.getMode().label() + " mode");
        } catch (SchedulerException e) {
            log.error("Scheduler failed to start: {}", e.getMessage(), e);
            ConsoleOutput.error("Scheduler failed to start: " + e.getMessage());
        }
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Scheduler server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
