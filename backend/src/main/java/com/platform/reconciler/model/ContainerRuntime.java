package com.platform.reconciler.model;

import java.util.List;

/**
 * OCI front-ends sharing the same create/start/stop/rm/exec/inspect command shape.
 */
public enum ContainerRuntime {
    PODMAN("podman", List.of("pacman", "-S", "--noconfirm")),
    DOCKER("docker", List.of("pacman", "-S", "--noconfirm")),
    TOOLBOX("toolbox", List.of("dnf", "install", "-y")),
    DISTROBOX("distrobox", List.of("pacman", "-S", "--noconfirm"));
    
    private final String command;
    private final List<String> packageInstallCommand;
    
    ContainerRuntime(String command, List<String> packageInstallCommand) {
        this.command = command;
        this.packageInstallCommand = packageInstallCommand;
    }
    
    public String command() {
        return command;
    }
    
    /**
     * Package manager invocation used inside containers of this runtime.
     */
    public List<String> packageInstallCommand() {
        return packageInstallCommand;
    }
}
