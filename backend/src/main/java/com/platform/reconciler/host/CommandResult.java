package com.platform.reconciler.host;

/**
 * Outcome of one external process invocation.
 */
public record CommandResult(
    int exitCode,
    String stdout,
    String stderr
) {
    
    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }
    
    public static CommandResult success(String stdout) {
        return new CommandResult(0, stdout, "");
    }
    
    public static CommandResult failure(int exitCode, String stderr) {
        return new CommandResult(exitCode, "", stderr);
    }
    
    public boolean isSuccess() {
        return exitCode == 0;
    }
    
    public String trimmedOutput() {
        return stdout.trim();
    }
}
