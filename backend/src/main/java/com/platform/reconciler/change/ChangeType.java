package com.platform.reconciler.change;

/**
 * Closed set of change variants. Appliers switch over this exhaustively.
 */
public enum ChangeType {
    SYSTEM_CONFIG,
    PACKAGE_INSTALL,
    PACKAGE_REMOVE,
    SERVICE_ADD,
    SERVICE_REMOVE,
    SERVICE_STATE,
    SERVICE_CONFIG,
    USER_ADD,
    USER_MODIFY,
    USER_REMOVE,
    REPOSITORY,
    DESKTOP_CONFIG,
    AUTOMATION_WORKFLOW
}
