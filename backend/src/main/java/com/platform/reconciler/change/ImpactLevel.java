package com.platform.reconciler.change;

public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;
    
    public boolean isAtLeast(ImpactLevel other) {
        return ordinal() >= other.ordinal();
    }
}
