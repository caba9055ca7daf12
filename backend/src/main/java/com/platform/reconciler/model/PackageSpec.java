package com.platform.reconciler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A package with the intent declared for it.
 */
public record PackageSpec(
    String name,
    PackageAction action,
    String group
) {
    
    public PackageSpec {
        action = action != null ? action : PackageAction.INSTALL;
    }
    
    public static PackageSpec install(String name) {
        return new PackageSpec(name, PackageAction.INSTALL, null);
    }
    
    public static PackageSpec remove(String name) {
        return new PackageSpec(name, PackageAction.REMOVE, null);
    }
    
    @JsonIgnore
    public boolean isInstall() {
        return action == PackageAction.INSTALL;
    }
}
