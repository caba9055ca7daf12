package com.platform.reconciler.change;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions detected changes by update strategy.
 * A change carrying a weaker strategy than the policy table assigns is promoted, never demoted.
 */
@Slf4j
@Component
public class UpdateClassifier {
    
    private final UpdatePolicy policy;
    
    public UpdateClassifier(UpdatePolicy policy) {
        this.policy = policy;
    }
    
    public CategorizedChanges categorize(List<ConfigChange> changes) {
        List<ConfigChange> live = new ArrayList<>();
        List<ConfigChange> serviceReload = new ArrayList<>();
        List<ConfigChange> rebootRequired = new ArrayList<>();
        
        for (ConfigChange change : changes) {
            ConfigChange classified = classify(change);
            switch (classified.updateStrategy()) {
                case LIVE -> live.add(classified);
                case SERVICE_RELOAD -> serviceReload.add(classified);
                case REBOOT_REQUIRED -> rebootRequired.add(classified);
            }
        }
        
        log.debug("Categorized {} changes: live={}, reload={}, reboot={}",
            changes.size(), live.size(), serviceReload.size(), rebootRequired.size());
        
        return new CategorizedChanges(live, serviceReload, rebootRequired);
    }
    
    ConfigChange classify(ConfigChange change) {
        UpdateStrategy required = policy.strategyFor(change);
        UpdateStrategy carried = change.updateStrategy();
        UpdateStrategy effective = carried == null ? required : carried.stricter(required);
        
        if (effective != carried) {
            if (carried != null) {
                log.warn("Promoting {} change from {} to {}: {}",
                    change.type(), carried, effective, change.description());
            }
            return change.withStrategy(effective);
        }
        return change;
    }
}
