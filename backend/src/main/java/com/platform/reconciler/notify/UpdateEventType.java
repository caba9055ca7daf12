package com.platform.reconciler.notify;

public enum UpdateEventType {
    UPDATE_STARTED,
    NO_CHANGES,
    REBOOT_REQUIRED,
    CHANGE_APPLIED,
    CHANGE_FAILED,
    UPDATE_COMPLETED,
    UPDATE_FAILED,
    ROLLBACK_STARTED,
    ROLLBACK_COMPLETED,
    ROLLBACK_FAILED
}
