package com.maascheduler.core.executor;

import com.maascheduler.core.config.SchedulerProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ShellRunner} backed by {@code /bin/sh -c}.
 * <p>
 * Standard output and standard error are drained concurrently, line by line, on a dedicated I/O pool.
 * When the calling thread is interrupted the whole process tree receives a graceful termination
 * signal; anything still alive after the grace period is killed forcibly.
 */
@Component
public class ProcessShellRunner implements ShellRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessShellRunner.class);

    /** How long to wait for the stream readers once the process has exited. */
    private static final long DRAIN_TIMEOUT_MS = 5_000;

    private final Duration gracePeriod;
    private final ExecutorService ioPool;

    @Autowired
    public ProcessShellRunner(SchedulerProperties properties) {
        this(properties.getScheduler().getCancelGracePeriod());
    }

    public ProcessShellRunner(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
        AtomicInteger counter = new AtomicInteger();
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "shell-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CommandResult run(ShellCommand command, OutputListener listener) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command.commandLine());
        if (command.workingDirectory() != null) {
            pb.directory(command.workingDirectory().toFile());
        }
        pb.environment().putAll(command.environment());

        log.debug("Executing command: {}", command.commandLine());
        Process process = pb.start();
        process.getOutputStream().close();

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Future<?> outReader = ioPool.submit(() ->
                drain(process.getInputStream(), OutputListener.Stream.STDOUT, stdout, listener));
        Future<?> errReader = ioPool.submit(() ->
                drain(process.getErrorStream(), OutputListener.Stream.STDERR, stderr, listener));

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            log.warn("Command cancelled, terminating process tree of pid {}", process.pid());
            terminateTree(process);
            outReader.cancel(true);
            errReader.cancel(true);
            throw e;
        }

        awaitReader(outReader);
        awaitReader(errReader);

        return new CommandResult(exitCode, snapshot(stdout), snapshot(stderr));
    }

    /**
     * Terminates the process and every descendant: graceful signal first, forced kill after the
     * grace period. Runs with the caller's interrupt flag cleared so the wait is not cut short.
     */
    void terminateTree(Process process) {
        boolean interrupted = Thread.interrupted();
        try {
            Set<ProcessHandle> tree = new LinkedHashSet<>();
            process.descendants().forEach(tree::add);
            tree.add(process.toHandle());

            tree.forEach(ProcessHandle::destroy);

            long deadline = System.nanoTime() + gracePeriod.toNanos();
            for (ProcessHandle handle : tree) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                try {
                    handle.onExit().get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException | ExecutionException e) {
                    log.debug("Process {} still alive after graceful termination", handle.pid());
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                }
            }

            for (ProcessHandle handle : tree) {
                if (handle.isAlive()) {
                    handle.descendants().forEach(ProcessHandle::destroyForcibly);
                    handle.destroyForcibly();
                    log.warn("Force-killed process {}", handle.pid());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void drain(InputStream stream, OutputListener.Stream kind, StringBuilder sink, OutputListener listener) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (sink) {
                    sink.append(line).append('\n');
                }
                try {
                    listener.onLine(kind, line);
                } catch (RuntimeException e) {
                    log.warn("Output listener failed on {} line: {}", kind, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.debug("{} stream closed: {}", kind, e.getMessage());
        }
    }

    private void awaitReader(Future<?> reader) throws InterruptedException {
        try {
            reader.get(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Output stream still open after process exit, abandoning reader");
            reader.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Output reader failed: {}", e.getCause().getMessage());
        }
    }

    private static String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }

    @PreDestroy
    void shutdown() {
        ioPool.shutdownNow();
    }
}
