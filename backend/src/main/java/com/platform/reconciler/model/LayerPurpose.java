package com.platform.reconciler.model;

public enum LayerPurpose {
    DEVELOPMENT,
    GAMING,
    MULTIMEDIA,
    OFFICE,
    SECURITY,
    NETWORKING,
    CUSTOM
}
