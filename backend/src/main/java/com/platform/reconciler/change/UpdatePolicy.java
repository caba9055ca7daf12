package com.platform.reconciler.change;

import com.platform.reconciler.model.DesktopConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static policy table: update strategy and impact per change type.
 * The reloadable-service allow-list comes from configuration.
 */
@Slf4j
@Component
public class UpdatePolicy {
    
    private final Set<String> reloadableServices;
    
    public UpdatePolicy(
            @Value("${reconciler.services.reloadable:nginx,apache2,httpd,postfix,dovecot,bind9,named,sshd,NetworkManager,systemd-resolved,systemd-timesyncd}")
            List<String> reloadableServices) {
        this.reloadableServices = Set.copyOf(reloadableServices);
        log.info("Update policy initialized with {} reloadable services", this.reloadableServices.size());
    }
    
    public boolean isReloadable(String service) {
        return service != null && reloadableServices.contains(service);
    }
    
    public Set<String> reloadableServices() {
        return reloadableServices;
    }
    
    /**
     * Strategy the table assigns to a change, independent of what the change carries.
     */
    public UpdateStrategy strategyFor(ConfigChange change) {
        return switch (change.type()) {
            case SYSTEM_CONFIG, PACKAGE_INSTALL, PACKAGE_REMOVE, USER_ADD, USER_MODIFY,
                 REPOSITORY, AUTOMATION_WORKFLOW -> UpdateStrategy.LIVE;
            case SERVICE_ADD, SERVICE_REMOVE, SERVICE_STATE -> UpdateStrategy.SERVICE_RELOAD;
            case SERVICE_CONFIG -> isReloadable(change.affectedService())
                ? UpdateStrategy.SERVICE_RELOAD
                : UpdateStrategy.REBOOT_REQUIRED;
            case USER_REMOVE -> UpdateStrategy.REBOOT_REQUIRED;
            case DESKTOP_CONFIG -> desktopStrategy(
                change.oldValueAs(DesktopConfig.class), change.newValueAs(DesktopConfig.class));
        };
    }
    
    public ImpactLevel impactFor(ChangeType type, String field, boolean presenceToggle) {
        return switch (type) {
            case SYSTEM_CONFIG -> "locale".equals(field) ? ImpactLevel.MEDIUM : ImpactLevel.LOW;
            case PACKAGE_INSTALL, PACKAGE_REMOVE, SERVICE_ADD, SERVICE_REMOVE, SERVICE_STATE, REPOSITORY ->
                ImpactLevel.MEDIUM;
            case SERVICE_CONFIG, USER_ADD, USER_MODIFY -> ImpactLevel.HIGH;
            case USER_REMOVE -> ImpactLevel.CRITICAL;
            case DESKTOP_CONFIG -> presenceToggle ? ImpactLevel.CRITICAL : ImpactLevel.HIGH;
            case AUTOMATION_WORKFLOW -> ImpactLevel.LOW;
        };
    }
    
    private UpdateStrategy desktopStrategy(DesktopConfig oldConfig, DesktopConfig newConfig) {
        if (oldConfig == null || newConfig == null) {
            return UpdateStrategy.REBOOT_REQUIRED;
        }
        return Objects.equals(oldConfig.environment(), newConfig.environment())
            ? UpdateStrategy.SERVICE_RELOAD
            : UpdateStrategy.REBOOT_REQUIRED;
    }
}
