package com.platform.reconciler.change;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.util.List;

/**
 * One detected difference between two configuration snapshots.
 * Derived on every reconciliation pass and never persisted.
 *
 * <p>Payload types per variant:
 * <ul>
 *   <li>SYSTEM_CONFIG: {@code String} old/new, {@code field} names the setting</li>
 *   <li>PACKAGE_INSTALL / PACKAGE_REMOVE: {@code List<PackageSpec>}</li>
 *   <li>SERVICE_*: {@code ServiceSpec}, {@code affectedService} set</li>
 *   <li>USER_ADD / USER_REMOVE: {@code List<UserSpec>}; USER_MODIFY: {@code UserSpec}</li>
 *   <li>REPOSITORY: {@code List<RepositorySpec>}</li>
 *   <li>DESKTOP_CONFIG: {@code DesktopConfig}, either side may be null</li>
 *   <li>AUTOMATION_WORKFLOW: {@code WorkflowSpec}, either side may be null, {@code field} is the workflow name</li>
 * </ul>
 */
@Builder(toBuilder = true)
public record ConfigChange(
    ChangeType type,
    String field,
    Object oldValue,
    Object newValue,
    String affectedService,
    String description,
    UpdateStrategy updateStrategy,
    ImpactLevel impactLevel
) {
    
    public ConfigChange withStrategy(UpdateStrategy strategy) {
        return toBuilder().updateStrategy(strategy).build();
    }
    
    ConfigChange withPolicy(UpdatePolicy policy) {
        return withStrategy(policy.strategyFor(this));
    }
    
    public <T> T oldValueAs(Class<T> type) {
        return oldValue == null ? null : type.cast(oldValue);
    }
    
    public <T> T newValueAs(Class<T> type) {
        return newValue == null ? null : type.cast(newValue);
    }
    
    public <T> List<T> oldValues(Class<T> elementType) {
        return castList(oldValue, elementType);
    }
    
    public <T> List<T> newValues(Class<T> elementType) {
        return castList(newValue, elementType);
    }
    
    private static <T> List<T> castList(Object value, Class<T> elementType) {
        if (value == null) {
            return List.of();
        }
        return ((List<?>) value).stream().map(elementType::cast).toList();
    }
    
    /**
     * Named resource this change touches. Changes sharing a key must be applied one after another.
     * User changes share one key because useradd/usermod lock the same account database.
     */
    @JsonIgnore
    public String resourceKey() {
        return switch (type) {
            case SYSTEM_CONFIG -> "system:" + field;
            case PACKAGE_INSTALL, PACKAGE_REMOVE, REPOSITORY -> "package-manager";
            case SERVICE_ADD, SERVICE_REMOVE, SERVICE_STATE, SERVICE_CONFIG -> "service:" + affectedService;
            case USER_ADD, USER_MODIFY, USER_REMOVE -> "accounts";
            case DESKTOP_CONFIG -> "desktop";
            case AUTOMATION_WORKFLOW -> "workflow:" + field;
        };
    }
}
