package com.platform.reconciler.api;

import com.platform.reconciler.change.ConfigChange;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.update.LiveUpdateCapability;
import com.platform.reconciler.update.LiveUpdateOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * Request and response bodies that have no counterpart in the domain packages.
 */
public class ApiRequests {
    
    /**
     * Live update request: the desired configuration plus run options.
     */
    @Data
    public static class UpdateRequest {
        
        @NotNull(message = "Desired configuration is required")
        @Valid
        private SystemConfiguration desired;
        
        private LiveUpdateOptions options;
        
        public LiveUpdateOptions effectiveOptions() {
            return options != null ? options : LiveUpdateOptions.defaults();
        }
    }
    
    /**
     * What an update to a configuration would do, computed against the last applied one.
     */
    public record UpdatePreview(
        List<ConfigChange> changes,
        LiveUpdateCapability capability
    ) {}
}
