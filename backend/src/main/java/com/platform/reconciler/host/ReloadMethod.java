package com.platform.reconciler.host;

public enum ReloadMethod {
    SIGNAL,
    COMMAND,
    SYSTEMD,
    RESTART,
    START
}
