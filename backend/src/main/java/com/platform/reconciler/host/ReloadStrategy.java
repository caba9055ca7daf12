package com.platform.reconciler.host;

import java.util.List;

/**
 * How a particular service picks up new configuration.
 */
public record ReloadStrategy(ReloadMethod method, List<String> command) {
    
    public ReloadStrategy {
        command = command != null ? List.copyOf(command) : List.of();
    }
    
    public static ReloadStrategy signal(String signal) {
        return new ReloadStrategy(ReloadMethod.SIGNAL, List.of(signal));
    }
    
    public static ReloadStrategy command(String... command) {
        return new ReloadStrategy(ReloadMethod.COMMAND, List.of(command));
    }
    
    public static ReloadStrategy systemd() {
        return new ReloadStrategy(ReloadMethod.SYSTEMD, List.of());
    }
    
    public static ReloadStrategy restart() {
        return new ReloadStrategy(ReloadMethod.RESTART, List.of());
    }
}
