package com.platform.reconciler.lifecycle;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Readiness and liveness of the reconciler process.
 */
@RestController
@RequestMapping("/api/lifecycle")
public class LifecycleController {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final GracefulShutdownManager shutdownManager;
    
    public LifecycleController(
            ApplicationLifecycleManager lifecycleManager,
            GracefulShutdownManager shutdownManager) {
        this.lifecycleManager = lifecycleManager;
        this.shutdownManager = shutdownManager;
    }
    
    @GetMapping("/status")
    public ResponseEntity<ApplicationLifecycleManager.LifecycleStatus> getStatus() {
        return ResponseEntity.ok(lifecycleManager.getStatus());
    }
    
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> isReady() {
        if (lifecycleManager.isReady()) {
            return ResponseEntity.ok(Map.of(
                "status", "ready",
                "phase", lifecycleManager.getCurrentPhase()
            ));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
            "status", "not_ready",
            "phase", lifecycleManager.getCurrentPhase()
        ));
    }
    
    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> isLive() {
        if (!shutdownManager.isShuttingDown()) {
            return ResponseEntity.ok(Map.of(
                "status", "alive",
                "phase", lifecycleManager.getCurrentPhase()
            ));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
            "status", "shutting_down",
            "phase", lifecycleManager.getCurrentPhase()
        ));
    }
}
