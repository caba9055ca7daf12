package com.platform.reconciler.api;

import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.system.DeploymentResult;
import com.platform.reconciler.system.SystemActionResult;
import com.platform.reconciler.system.SystemHealthReport;
import com.platform.reconciler.system.SystemManager;
import com.platform.reconciler.system.SystemStateRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for whole-system deployment, health and persisted state.
 */
@Slf4j
@RestController
@RequestMapping("/api/system")
public class SystemController {
    
    private final SystemManager systemManager;
    
    public SystemController(SystemManager systemManager) {
        this.systemManager = systemManager;
    }
    
    /**
     * Deploy containers and layers. Answers 422 when some of them failed.
     */
    @PostMapping("/deploy")
    public ResponseEntity<DeploymentResult> deploy(@RequestBody SystemConfiguration config) {
        DeploymentResult result = systemManager.deploySystem(config);
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }
    
    /**
     * Last health report, without running a new check.
     */
    @GetMapping("/health")
    public SystemHealthReport getHealth() {
        return systemManager.lastHealthReport();
    }
    
    @PostMapping("/health/check")
    public SystemHealthReport checkHealth() {
        return systemManager.checkSystemHealth();
    }
    
    @GetMapping("/state")
    public SystemStateRecord getState() {
        return systemManager.currentState();
    }
    
    @GetMapping(value = "/state/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public String exportState() {
        return systemManager.exportState();
    }
    
    @PostMapping(value = "/state/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SystemStateRecord importState(@RequestBody String json) {
        return systemManager.importState(json);
    }
    
    /**
     * Last applied configuration.
     */
    @GetMapping("/configuration")
    public SystemConfiguration getConfiguration() {
        return systemManager.currentConfiguration();
    }
    
    @PostMapping("/start")
    public ResponseEntity<SystemActionResult> start() {
        SystemActionResult result = systemManager.startSystem();
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
    
    @PostMapping("/stop")
    public ResponseEntity<SystemActionResult> stop() {
        SystemActionResult result = systemManager.stopSystem();
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
    
    @PostMapping("/cleanup")
    public Map<String, Object> cleanup() {
        int removed = systemManager.cleanupSystem();
        log.info("Cleanup requested through API, {} containers removed", removed);
        return Map.of("removedContainers", removed);
    }
}
