package com.platform.reconciler.model;

import lombok.Builder;

@Builder(toBuilder = true)
public record DesktopConfig(
    boolean enabled,
    String environment,
    boolean autoLogin,
    String autoLoginUser
) {
}
