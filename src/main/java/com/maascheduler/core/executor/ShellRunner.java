package com.maascheduler.core.executor;

import java.io.IOException;

/**
 * Runs an external command and streams its output.
 * <p>
 * Implementations block until the command exits. Interrupting the calling thread cancels the command:
 * the implementation must terminate the whole process tree before throwing {@link InterruptedException}.
 */
public interface ShellRunner {

    CommandResult run(ShellCommand command, OutputListener listener) throws IOException, InterruptedException;
}
