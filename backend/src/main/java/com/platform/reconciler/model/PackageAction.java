package com.platform.reconciler.model;

public enum PackageAction {
    INSTALL,
    REMOVE
}
