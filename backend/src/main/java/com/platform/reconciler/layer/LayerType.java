package com.platform.reconciler.layer;

public enum LayerType {
    BASE,
    SYSTEM,
    USER
}
