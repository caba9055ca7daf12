package com.platform.reconciler.host;

import com.platform.reconciler.error.CommandExecutionException;

import java.time.Duration;
import java.util.List;

/**
 * Narrow seam for every external process call (container runtimes, systemctl, useradd, ...).
 * Implementations must enforce the timeout and never block past it.
 */
public interface CommandRunner {
    
    /**
     * Run a command and return its result regardless of exit code.
     *
     * @throws com.platform.reconciler.error.CommandTimeoutException if the timeout elapses
     * @throws CommandExecutionException if the process cannot be started
     */
    CommandResult run(List<String> command, Duration timeout);
    
    /**
     * Run a command and fail on a non-zero exit code.
     */
    default CommandResult runChecked(List<String> command, Duration timeout) {
        CommandResult result = run(command, timeout);
        if (!result.isSuccess()) {
            throw new CommandExecutionException(command, result.exitCode(), result.stderr());
        }
        return result;
    }
}
