package com.platform.reconciler.update;

import com.platform.reconciler.error.ErrorCode;
import com.platform.reconciler.error.LiveUpdateException;
import com.platform.reconciler.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Tracks the phase of the live update run in progress and rejects illegal transitions.
 */
@Slf4j
@Component
public class UpdatePhaseMachine {
    
    // Valid phase transitions (from -> to)
    private static final Map<UpdatePhase, Set<UpdatePhase>> ALLOWED_TRANSITIONS = Map.of(
        UpdatePhase.IDLE, Set.of(UpdatePhase.DETECTING),
        UpdatePhase.DETECTING, Set.of(UpdatePhase.CLASSIFYING, UpdatePhase.COMMITTED, UpdatePhase.FAILED),
        UpdatePhase.CLASSIFYING, Set.of(UpdatePhase.REBOOT_BLOCKED, UpdatePhase.APPLYING, UpdatePhase.FAILED),
        UpdatePhase.APPLYING, Set.of(UpdatePhase.COMMITTED, UpdatePhase.ROLLED_BACK, UpdatePhase.FAILED),
        UpdatePhase.REBOOT_BLOCKED, Set.of(UpdatePhase.IDLE),
        UpdatePhase.COMMITTED, Set.of(UpdatePhase.IDLE),
        UpdatePhase.ROLLED_BACK, Set.of(UpdatePhase.IDLE),
        UpdatePhase.FAILED, Set.of(UpdatePhase.IDLE)
    );
    
    private final MetricsRegistry metricsRegistry;
    private volatile UpdatePhase current = UpdatePhase.IDLE;
    
    public UpdatePhaseMachine(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    public UpdatePhase current() {
        return current;
    }
    
    public static boolean isTransitionAllowed(UpdatePhase from, UpdatePhase to) {
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }
    
    /**
     * @throws LiveUpdateException with {@link ErrorCode#PHASE_TRANSITION_INVALID} for an illegal move
     */
    public synchronized void transition(UpdatePhase target) {
        UpdatePhase previous = current;
        if (!isTransitionAllowed(previous, target)) {
            throw new LiveUpdateException(ErrorCode.PHASE_TRANSITION_INVALID,
                String.format("Invalid update phase transition: %s -> %s", previous, target));
        }
        current = target;
        
        log.debug("Update phase: {} -> {}", previous, target);
        metricsRegistry.recordPhaseTransition(previous, target);
    }
    
    /**
     * Return to IDLE from whatever phase the run ended in.
     */
    public synchronized void reset() {
        if (current == UpdatePhase.IDLE) {
            return;
        }
        if (!current.isTerminal()) {
            transition(UpdatePhase.FAILED);
        }
        transition(UpdatePhase.IDLE);
    }
}
