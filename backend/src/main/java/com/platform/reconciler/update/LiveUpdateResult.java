package com.platform.reconciler.update;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.platform.reconciler.change.ConfigChange;

import java.util.List;

/**
 * Outcome of a live update run.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "outcome")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LiveUpdateResult.NoChangesRequired.class, name = "NO_CHANGES_REQUIRED"),
    @JsonSubTypes.Type(value = LiveUpdateResult.Success.class, name = "SUCCESS"),
    @JsonSubTypes.Type(value = LiveUpdateResult.PartialSuccess.class, name = "PARTIAL_SUCCESS"),
    @JsonSubTypes.Type(value = LiveUpdateResult.RebootRequired.class, name = "REBOOT_REQUIRED"),
    @JsonSubTypes.Type(value = LiveUpdateResult.Failed.class, name = "FAILED")
})
public sealed interface LiveUpdateResult {
    
    /**
     * Metric and log label of this outcome.
     */
    String outcome();
    
    record NoChangesRequired(String message) implements LiveUpdateResult {
        
        public static final NoChangesRequired INSTANCE =
            new NoChangesRequired("System configuration is already up to date");
        
        @Override
        public String outcome() {
            return "no_changes";
        }
    }
    
    record Success(List<ConfigChange> applied, List<ConfigChange> pendingReboot) implements LiveUpdateResult {
        
        public Success {
            applied = List.copyOf(applied);
            pendingReboot = List.copyOf(pendingReboot);
        }
        
        @Override
        public String outcome() {
            return "success";
        }
    }
    
    record PartialSuccess(
        List<ConfigChange> applied,
        List<FailedChange> failed,
        List<ConfigChange> pendingReboot
    ) implements LiveUpdateResult {
        
        public PartialSuccess {
            applied = List.copyOf(applied);
            failed = List.copyOf(failed);
            pendingReboot = List.copyOf(pendingReboot);
        }
        
        @Override
        public String outcome() {
            return "partial_success";
        }
    }
    
    /**
     * Nothing was touched: the listed changes need a reboot and partial updates were not allowed.
     */
    record RebootRequired(List<ConfigChange> changes) implements LiveUpdateResult {
        
        public RebootRequired {
            changes = List.copyOf(changes);
        }
        
        @Override
        public String outcome() {
            return "reboot_required";
        }
    }
    
    /**
     * The run aborted. {@code rolledBack} tells whether the pre-update snapshot was restored.
     */
    record Failed(
        String errorCode,
        String error,
        List<ConfigChange> applied,
        List<FailedChange> failed,
        boolean rolledBack
    ) implements LiveUpdateResult {
        
        public Failed {
            applied = List.copyOf(applied);
            failed = List.copyOf(failed);
        }
        
        @Override
        public String outcome() {
            return "failed";
        }
    }
}
