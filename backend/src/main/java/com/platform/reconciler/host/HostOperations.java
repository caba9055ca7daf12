package com.platform.reconciler.host;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.reconciler.error.ChangeApplyException;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.RepositorySpec;
import com.platform.reconciler.model.UserSpec;
import com.platform.reconciler.model.WorkflowSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Host-level mutations and queries issued through the {@link CommandRunner}.
 */
@Slf4j
@Component
public class HostOperations {
    
    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final Duration commandTimeout;
    private final Duration packageTimeout;
    private final Path repositoryFile;
    private final Path automationDir;
    
    public HostOperations(
            CommandRunner commandRunner,
            ObjectMapper objectMapper,
            @Value("${reconciler.command.timeout:PT2M}") Duration commandTimeout,
            @Value("${reconciler.command.package-timeout:PT30M}") Duration packageTimeout,
            @Value("${reconciler.host.repository-file:/etc/pacman.d/horizonos-repos.conf}") Path repositoryFile,
            @Value("${reconciler.host.automation-dir:/etc/horizonos/automation}") Path automationDir) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.commandTimeout = commandTimeout;
        this.packageTimeout = packageTimeout;
        this.repositoryFile = repositoryFile;
        this.automationDir = automationDir;
    }
    
    // ==================== System Settings ====================
    
    public void setHostname(String hostname) {
        commandRunner.runChecked(List.of("hostnamectl", "set-hostname", hostname), commandTimeout);
        log.info("Hostname set to {}", hostname);
    }
    
    public void setTimezone(String timezone) {
        commandRunner.runChecked(List.of("timedatectl", "set-timezone", timezone), commandTimeout);
        log.info("Timezone set to {}", timezone);
    }
    
    public void setLocale(String locale) {
        commandRunner.runChecked(List.of("localectl", "set-locale", "LANG=" + locale), commandTimeout);
        log.info("Locale set to {}", locale);
    }
    
    public String currentHostname() {
        return commandRunner.runChecked(List.of("hostname"), commandTimeout).trimmedOutput();
    }
    
    public String currentTimezone() {
        return commandRunner.runChecked(
            List.of("timedatectl", "show", "-p", "Timezone", "--value"), commandTimeout).trimmedOutput();
    }
    
    public String currentLocale() {
        String status = commandRunner.runChecked(List.of("localectl", "status"), commandTimeout).stdout();
        return status.lines()
            .map(String::trim)
            .filter(line -> line.startsWith("System Locale:"))
            .map(line -> line.substring(line.indexOf("LANG=") + 5).trim())
            .findFirst()
            .orElse("");
    }
    
    /**
     * Capture hostname, timezone, locale and enablement of the given services.
     */
    public HostFacts captureFacts(Collection<String> services) {
        Map<String, Boolean> enablement = new LinkedHashMap<>();
        for (String service : services) {
            enablement.put(service, isServiceEnabled(service));
        }
        return new HostFacts(currentHostname(), currentTimezone(), currentLocale(), enablement);
    }
    
    // ==================== Packages ====================
    
    public void installPackages(List<PackageSpec> packages) {
        if (packages.isEmpty()) {
            return;
        }
        List<String> command = new ArrayList<>(List.of("pacman", "-S", "--noconfirm", "--needed"));
        packages.forEach(p -> command.add(p.name()));
        commandRunner.runChecked(command, packageTimeout);
        log.info("Installed {} packages", packages.size());
    }
    
    public void removePackages(List<PackageSpec> packages) {
        if (packages.isEmpty()) {
            return;
        }
        List<String> command = new ArrayList<>(List.of("pacman", "-R", "--noconfirm"));
        packages.forEach(p -> command.add(p.name()));
        commandRunner.runChecked(command, packageTimeout);
        log.info("Removed {} packages", packages.size());
    }
    
    public Set<String> installedPackages() {
        return commandRunner.runChecked(List.of("pacman", "-Qq"), commandTimeout).stdout()
            .lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toSet());
    }
    
    // ==================== Users ====================
    
    public void createUser(UserSpec user) {
        List<String> command = new ArrayList<>(List.of("useradd", "-m"));
        if (user.uid() != null) {
            command.addAll(List.of("-u", String.valueOf(user.uid())));
        }
        command.addAll(List.of("-s", user.shell()));
        if (!user.groups().isEmpty()) {
            command.addAll(List.of("-G", String.join(",", user.groups())));
        }
        if (user.homeDir() != null) {
            command.addAll(List.of("-d", user.homeDir()));
        }
        command.add(user.name());
        commandRunner.runChecked(command, commandTimeout);
        log.info("Created user {}", user.name());
    }
    
    /**
     * Apply only the fields that differ between the two definitions.
     */
    public void modifyUser(UserSpec current, UserSpec desired) {
        List<String> command = new ArrayList<>(List.of("usermod"));
        if (!Objects.equals(current.uid(), desired.uid()) && desired.uid() != null) {
            command.addAll(List.of("-u", String.valueOf(desired.uid())));
        }
        if (!Objects.equals(current.shell(), desired.shell())) {
            command.addAll(List.of("-s", desired.shell()));
        }
        if (!Objects.equals(current.groups(), desired.groups())) {
            command.addAll(List.of("-G", String.join(",", desired.groups())));
        }
        if (!Objects.equals(current.homeDir(), desired.homeDir()) && desired.homeDir() != null) {
            command.addAll(List.of("-d", desired.homeDir(), "-m"));
        }
        if (command.size() == 1) {
            log.debug("No user fields to modify for {}", desired.name());
            return;
        }
        command.add(desired.name());
        commandRunner.runChecked(command, commandTimeout);
        log.info("Modified user {}", desired.name());
    }
    
    // ==================== Repositories ====================
    
    /**
     * Rewrite the managed repository file and refresh package databases.
     */
    public void syncRepositories(List<RepositorySpec> repositories) {
        StringBuilder content = new StringBuilder("# Managed by system-reconciler\n");
        repositories.stream()
            .filter(RepositorySpec::enabled)
            .sorted(Comparator.comparing(RepositorySpec::priority))
            .forEach(repo -> content
                .append('\n')
                .append('[').append(repo.name()).append("]\n")
                .append("SigLevel = ").append(repo.gpgCheck() ? "Required DatabaseOptional" : "Never").append('\n')
                .append("Server = ").append(repo.url()).append('\n'));
        
        try {
            AtomicFiles.write(repositoryFile, content.toString().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ChangeApplyException("Failed to write repository file " + repositoryFile, e);
        }
        commandRunner.runChecked(List.of("pacman", "-Sy"), packageTimeout);
        log.info("Synchronized {} repositories", repositories.size());
    }
    
    // ==================== Automation ====================
    
    public void writeWorkflow(WorkflowSpec workflow) {
        Path target = automationDir.resolve(workflow.name() + ".json");
        try {
            AtomicFiles.write(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(workflow));
        } catch (IOException e) {
            throw new ChangeApplyException("Failed to write workflow " + workflow.name(), e);
        }
        log.info("Workflow {} written to {}", workflow.name(), target);
    }
    
    public void removeWorkflow(String name) {
        Path target = automationDir.resolve(name + ".json");
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new ChangeApplyException("Failed to remove workflow " + name, e);
        }
        log.info("Workflow {} removed", name);
    }
    
    // ==================== Services ====================
    
    public boolean isServiceEnabled(String service) {
        CommandResult result = commandRunner.run(List.of("systemctl", "is-enabled", service), commandTimeout);
        return result.isSuccess() && "enabled".equals(result.trimmedOutput());
    }
    
    public boolean isServiceActive(String service) {
        CommandResult result = commandRunner.run(List.of("systemctl", "is-active", service), commandTimeout);
        return result.isSuccess() && "active".equals(result.trimmedOutput());
    }
    
    public void enableService(String service) {
        commandRunner.runChecked(List.of("systemctl", "enable", "--now", service), commandTimeout);
        log.info("Enabled service {}", service);
    }
    
    public void disableService(String service) {
        commandRunner.runChecked(List.of("systemctl", "disable", "--now", service), commandTimeout);
        log.info("Disabled service {}", service);
    }
}
