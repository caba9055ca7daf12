package com.platform.reconciler.error;

import java.time.Duration;
import java.util.List;

/**
 * External process did not finish within its timeout and was killed.
 */
public class CommandTimeoutException extends CommandExecutionException {
    
    private final Duration timeout;
    
    public CommandTimeoutException(List<String> command, Duration timeout) {
        super(ErrorCode.COMMAND_TIMEOUT, command, 
            String.format("Command '%s' timed out after %dms", String.join(" ", command), timeout.toMillis()));
        this.timeout = timeout;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
