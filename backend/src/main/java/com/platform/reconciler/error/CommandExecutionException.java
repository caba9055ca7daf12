package com.platform.reconciler.error;

import java.util.List;

/**
 * External process exited unsuccessfully or could not be started.
 */
public class CommandExecutionException extends ReconcilerException {
    
    private final List<String> command;
    private final int exitCode;
    
    public CommandExecutionException(List<String> command, int exitCode, String stderr) {
        super(ErrorCode.COMMAND_FAILED, String.format("Command '%s' exited with %d: %s",
            String.join(" ", command), exitCode, stderr == null ? "" : stderr.trim()));
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
    }
    
    public CommandExecutionException(List<String> command, String message, Throwable cause) {
        super(ErrorCode.COMMAND_FAILED, 
            String.format("Command '%s' failed: %s", String.join(" ", command), message), cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }
    
    protected CommandExecutionException(ErrorCode errorCode, List<String> command, String message) {
        super(errorCode, message);
        this.command = List.copyOf(command);
        this.exitCode = -1;
    }
    
    public List<String> getCommand() {
        return command;
    }
    
    public int getExitCode() {
        return exitCode;
    }
}
