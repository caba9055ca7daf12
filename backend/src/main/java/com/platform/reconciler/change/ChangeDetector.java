package com.platform.reconciler.change;

import com.platform.reconciler.model.AutomationConfig;
import com.platform.reconciler.model.DesktopConfig;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.RepositorySpec;
import com.platform.reconciler.model.ServiceSpec;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.SystemSettings;
import com.platform.reconciler.model.UserSpec;
import com.platform.reconciler.model.WorkflowSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes the changes needed to go from one configuration snapshot to another.
 * Pure: no state, no I/O, never throws for two valid snapshots.
 */
@Component
public class ChangeDetector {
    
    /** systemd alias of whichever display manager the desktop environment installs. */
    static final String DISPLAY_MANAGER = "display-manager";
    
    private final UpdatePolicy policy;
    
    public ChangeDetector(UpdatePolicy policy) {
        this.policy = policy;
    }
    
    /**
     * Detect all changes between two configurations, in a stable order:
     * system, packages, services, users, repositories, desktop, automation.
     */
    public List<ConfigChange> detectChanges(SystemConfiguration current, SystemConfiguration desired) {
        List<ConfigChange> changes = new ArrayList<>();
        
        changes.addAll(detectSystemChanges(current.system(), desired.system()));
        changes.addAll(detectPackageChanges(current.packages(), desired.packages()));
        changes.addAll(detectServiceChanges(current.services(), desired.services()));
        changes.addAll(detectUserChanges(current.users(), desired.users()));
        changes.addAll(detectRepositoryChanges(current.repositories(), desired.repositories()));
        changes.addAll(detectDesktopChanges(current.desktop(), desired.desktop()));
        changes.addAll(detectAutomationChanges(current.automation(), desired.automation()));
        
        return List.copyOf(changes);
    }
    
    // ==================== System ====================
    
    private List<ConfigChange> detectSystemChanges(SystemSettings current, SystemSettings desired) {
        List<ConfigChange> changes = new ArrayList<>();
        
        compareSetting(changes, "hostname", "Hostname", current.hostname(), desired.hostname());
        compareSetting(changes, "timezone", "Timezone", current.timezone(), desired.timezone());
        compareSetting(changes, "locale", "Locale", current.locale(), desired.locale());
        
        return changes;
    }
    
    private void compareSetting(List<ConfigChange> changes, String field, String label, String oldValue, String newValue) {
        if (!Objects.equals(oldValue, newValue)) {
            changes.add(change(ChangeType.SYSTEM_CONFIG)
                .field(field)
                .oldValue(oldValue)
                .newValue(newValue)
                .description(String.format("%s change: %s → %s", label, oldValue, newValue))
                .impactLevel(policy.impactFor(ChangeType.SYSTEM_CONFIG, field, false))
                .build()
                .withPolicy(policy));
        }
    }
    
    // ==================== Packages ====================
    
    private List<ConfigChange> detectPackageChanges(List<PackageSpec> current, List<PackageSpec> desired) {
        List<ConfigChange> changes = new ArrayList<>();
        Map<String, PackageSpec> currentByName = byName(current, PackageSpec::name);
        Map<String, PackageSpec> desiredByName = byName(desired, PackageSpec::name);
        
        List<PackageSpec> toInstall = desiredByName.values().stream()
            .filter(PackageSpec::isInstall)
            .filter(pkg -> !isInstalled(currentByName.get(pkg.name())))
            .toList();
        
        if (!toInstall.isEmpty()) {
            changes.add(change(ChangeType.PACKAGE_INSTALL)
                .oldValue(List.of())
                .newValue(toInstall)
                .description("Install packages: " + names(toInstall, PackageSpec::name))
                .impactLevel(policy.impactFor(ChangeType.PACKAGE_INSTALL, null, false))
                .build()
                .withPolicy(policy));
        }
        
        // Removal wins only when the desired snapshot has no install intent for the name
        List<PackageSpec> toRemove = currentByName.values().stream()
            .filter(PackageSpec::isInstall)
            .filter(pkg -> !isInstalled(desiredByName.get(pkg.name())))
            .toList();
        
        if (!toRemove.isEmpty()) {
            changes.add(change(ChangeType.PACKAGE_REMOVE)
                .oldValue(toRemove)
                .newValue(List.of())
                .description("Remove packages: " + names(toRemove, PackageSpec::name))
                .impactLevel(policy.impactFor(ChangeType.PACKAGE_REMOVE, null, false))
                .build()
                .withPolicy(policy));
        }
        
        return changes;
    }
    
    private static boolean isInstalled(PackageSpec pkg) {
        return pkg != null && pkg.isInstall();
    }
    
    // ==================== Services ====================
    
    private List<ConfigChange> detectServiceChanges(List<ServiceSpec> current, List<ServiceSpec> desired) {
        List<ConfigChange> changes = new ArrayList<>();
        Map<String, ServiceSpec> currentByName = byName(current, ServiceSpec::name);
        Map<String, ServiceSpec> desiredByName = byName(desired, ServiceSpec::name);
        
        for (ServiceSpec service : desiredByName.values()) {
            ServiceSpec existing = currentByName.get(service.name());
            
            if (existing == null) {
                changes.add(serviceChange(ChangeType.SERVICE_ADD, null, service,
                    String.format("Add service: %s (%s)", service.name(), service.enabled() ? "enabled" : "disabled")));
                continue;
            }
            
            if (existing.enabled() != service.enabled()) {
                changes.add(serviceChange(ChangeType.SERVICE_STATE, existing, service,
                    String.format("Service %s: %s", service.name(), service.enabled() ? "enable" : "disable")));
            }
            
            if (!Objects.equals(existing.config(), service.config())) {
                changes.add(serviceChange(ChangeType.SERVICE_CONFIG, existing, service,
                    "Update configuration for service: " + service.name()));
            }
        }
        
        for (ServiceSpec service : currentByName.values()) {
            if (!desiredByName.containsKey(service.name())) {
                changes.add(serviceChange(ChangeType.SERVICE_REMOVE, service, null,
                    "Remove service: " + service.name()));
            }
        }
        
        return changes;
    }
    
    private ConfigChange serviceChange(ChangeType type, ServiceSpec oldValue, ServiceSpec newValue, String description) {
        String name = newValue != null ? newValue.name() : oldValue.name();
        return change(type)
            .oldValue(oldValue)
            .newValue(newValue)
            .affectedService(name)
            .description(description)
            .impactLevel(policy.impactFor(type, null, false))
            .build()
            .withPolicy(policy);
    }
    
    // ==================== Users ====================
    
    private List<ConfigChange> detectUserChanges(List<UserSpec> current, List<UserSpec> desired) {
        List<ConfigChange> changes = new ArrayList<>();
        Map<String, UserSpec> currentByName = byName(current, UserSpec::name);
        Map<String, UserSpec> desiredByName = byName(desired, UserSpec::name);
        
        List<UserSpec> added = desiredByName.values().stream()
            .filter(user -> !currentByName.containsKey(user.name()))
            .toList();
        
        if (!added.isEmpty()) {
            changes.add(change(ChangeType.USER_ADD)
                .oldValue(List.of())
                .newValue(added)
                .description("Add users: " + names(added, UserSpec::name))
                .impactLevel(policy.impactFor(ChangeType.USER_ADD, null, false))
                .build()
                .withPolicy(policy));
        }
        
        for (UserSpec user : desiredByName.values()) {
            UserSpec existing = currentByName.get(user.name());
            if (existing == null || existing.equals(user)) {
                continue;
            }
            
            List<String> modifications = new ArrayList<>();
            if (!Objects.equals(existing.uid(), user.uid())) {
                modifications.add("UID");
            }
            if (!Objects.equals(existing.shell(), user.shell())) {
                modifications.add("shell");
            }
            if (!Objects.equals(existing.groups(), user.groups())) {
                modifications.add("groups");
            }
            if (!Objects.equals(existing.homeDir(), user.homeDir())) {
                modifications.add("home directory");
            }
            
            if (!modifications.isEmpty()) {
                changes.add(change(ChangeType.USER_MODIFY)
                    .field(user.name())
                    .oldValue(existing)
                    .newValue(user)
                    .description(String.format("Modify user %s: %s", user.name(), String.join(", ", modifications)))
                    .impactLevel(policy.impactFor(ChangeType.USER_MODIFY, null, false))
                    .build()
                    .withPolicy(policy));
            }
        }
        
        List<UserSpec> removed = currentByName.values().stream()
            .filter(user -> !desiredByName.containsKey(user.name()))
            .toList();
        
        if (!removed.isEmpty()) {
            changes.add(change(ChangeType.USER_REMOVE)
                .oldValue(removed)
                .newValue(List.of())
                .description("Remove users: " + names(removed, UserSpec::name))
                .impactLevel(policy.impactFor(ChangeType.USER_REMOVE, null, false))
                .build()
                .withPolicy(policy));
        }
        
        return changes;
    }
    
    // ==================== Repositories ====================
    
    private List<ConfigChange> detectRepositoryChanges(List<RepositorySpec> current, List<RepositorySpec> desired) {
        if (new HashSet<>(current).equals(new HashSet<>(desired))) {
            return List.of();
        }
        
        return List.of(change(ChangeType.REPOSITORY)
            .oldValue(current)
            .newValue(desired)
            .description("Repository configuration changed")
            .impactLevel(policy.impactFor(ChangeType.REPOSITORY, null, false))
            .build()
            .withPolicy(policy));
    }
    
    // ==================== Desktop ====================
    
    private List<ConfigChange> detectDesktopChanges(DesktopConfig current, DesktopConfig desired) {
        if (Objects.equals(current, desired)) {
            return List.of();
        }
        
        String description;
        if (current == null) {
            description = "Enable desktop environment: " + desired.environment();
        } else if (desired == null) {
            description = "Disable desktop environment";
        } else {
            description = "Update desktop configuration";
        }
        
        boolean presenceToggle = current == null || desired == null;
        return List.of(change(ChangeType.DESKTOP_CONFIG)
            .oldValue(current)
            .newValue(desired)
            .affectedService(DISPLAY_MANAGER)
            .description(description)
            .impactLevel(policy.impactFor(ChangeType.DESKTOP_CONFIG, null, presenceToggle))
            .build()
            .withPolicy(policy));
    }
    
    // ==================== Automation ====================
    
    private List<ConfigChange> detectAutomationChanges(AutomationConfig current, AutomationConfig desired) {
        Map<String, WorkflowSpec> currentByName = byName(workflows(current), WorkflowSpec::name);
        Map<String, WorkflowSpec> desiredByName = byName(workflows(desired), WorkflowSpec::name);
        List<ConfigChange> changes = new ArrayList<>();
        
        for (WorkflowSpec workflow : desiredByName.values()) {
            WorkflowSpec existing = currentByName.get(workflow.name());
            if (existing == null) {
                changes.add(workflowChange(workflow.name(), null, workflow, "Add automation workflow: "));
            } else if (!existing.equals(workflow)) {
                changes.add(workflowChange(workflow.name(), existing, workflow, "Update automation workflow: "));
            }
        }
        
        for (WorkflowSpec workflow : currentByName.values()) {
            if (!desiredByName.containsKey(workflow.name())) {
                changes.add(workflowChange(workflow.name(), workflow, null, "Remove automation workflow: "));
            }
        }
        
        return changes;
    }
    
    private ConfigChange workflowChange(String name, WorkflowSpec oldValue, WorkflowSpec newValue, String prefix) {
        return change(ChangeType.AUTOMATION_WORKFLOW)
            .field(name)
            .oldValue(oldValue)
            .newValue(newValue)
            .description(prefix + name)
            .impactLevel(policy.impactFor(ChangeType.AUTOMATION_WORKFLOW, null, false))
            .build()
            .withPolicy(policy);
    }
    
    private static List<WorkflowSpec> workflows(AutomationConfig config) {
        return config != null ? config.workflows() : List.of();
    }
    
    // ==================== Helpers ====================
    
    private static ConfigChange.ConfigChangeBuilder change(ChangeType type) {
        return ConfigChange.builder().type(type);
    }
    
    private static <T> Map<String, T> byName(List<T> items, Function<T, String> nameOf) {
        return items.stream().collect(Collectors.toMap(nameOf, Function.identity(), (first, second) -> second, LinkedHashMap::new));
    }
    
    private static <T> String names(List<T> items, Function<T, String> nameOf) {
        return items.stream().map(nameOf).collect(Collectors.joining(", "));
    }
}
