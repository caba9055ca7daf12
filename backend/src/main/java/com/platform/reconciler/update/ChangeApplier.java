package com.platform.reconciler.update;

import com.platform.reconciler.change.ConfigChange;
import com.platform.reconciler.error.ChangeApplyException;
import com.platform.reconciler.host.HostOperations;
import com.platform.reconciler.host.ServiceReloader;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.RepositorySpec;
import com.platform.reconciler.model.ServiceSpec;
import com.platform.reconciler.model.UserSpec;
import com.platform.reconciler.model.WorkflowSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns one classified change into host operations.
 * Errors propagate to the caller, which records them per change.
 */
@Slf4j
@Component
public class ChangeApplier {

    private final HostOperations host;
    private final ServiceReloader serviceReloader;

    public ChangeApplier(HostOperations host, ServiceReloader serviceReloader) {
        this.host = host;
        this.serviceReloader = serviceReloader;
    }

    /**
     * Apply a change from the live bucket.
     *
     * @throws ChangeApplyException for change types that cannot be applied live
     */
    public void applyLive(ConfigChange change, boolean dryRun) {
        if (dryRun) {
            log.info("[dry-run] Would apply {}: {}", change.type(), change.description());
            return;
        }

        switch (change.type()) {
            case SYSTEM_CONFIG -> applySystemSetting(change);
            case PACKAGE_INSTALL -> host.installPackages(change.newValues(PackageSpec.class));
            case PACKAGE_REMOVE -> host.removePackages(change.oldValues(PackageSpec.class));
            case USER_ADD -> change.newValues(UserSpec.class).forEach(host::createUser);
            case USER_MODIFY -> host.modifyUser(change.oldValueAs(UserSpec.class), change.newValueAs(UserSpec.class));
            case REPOSITORY -> host.syncRepositories(change.newValues(RepositorySpec.class));
            case AUTOMATION_WORKFLOW -> {
                WorkflowSpec workflow = change.newValueAs(WorkflowSpec.class);
                if (workflow == null) {
                    host.removeWorkflow(change.field());
                } else {
                    host.writeWorkflow(workflow);
                }
            }
            default -> throw new ChangeApplyException("Unsupported live change type: " + change.type());
        }
        log.info("Applied {}: {}", change.type(), change.description());
    }

    /**
     * Apply a change from the service-reload bucket.
     */
    public void applyReload(ConfigChange change, boolean dryRun) {
        String service = change.affectedService();
        if (service == null) {
            throw new ChangeApplyException("Service name required for reload: " + change.description());
        }
        if (dryRun) {
            log.info("[dry-run] Would apply {} to service {}", change.type(), service);
            return;
        }

        switch (change.type()) {
            case SERVICE_ADD, SERVICE_STATE -> {
                ServiceSpec spec = change.newValueAs(ServiceSpec.class);
                if (spec.enabled()) {
                    host.enableService(service);
                } else {
                    host.disableService(service);
                }
            }
            case SERVICE_REMOVE -> host.disableService(service);
            case SERVICE_CONFIG, DESKTOP_CONFIG -> serviceReloader.reload(service);
            default -> throw new ChangeApplyException("Unsupported reload change type: " + change.type());
        }
        log.info("Applied {} to service {}", change.type(), service);
    }

    private void applySystemSetting(ConfigChange change) {
        String value = change.newValueAs(String.class);
        switch (String.valueOf(change.field())) {
            case "hostname" -> host.setHostname(value);
            case "timezone" -> host.setTimezone(value);
            case "locale" -> host.setLocale(value);
            default -> throw new ChangeApplyException("Unknown system setting: " + change.field());
        }
    }
}
