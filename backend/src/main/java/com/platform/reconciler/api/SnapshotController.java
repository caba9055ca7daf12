package com.platform.reconciler.api;

import com.platform.reconciler.snapshot.SnapshotInfo;
import com.platform.reconciler.snapshot.StateSnapshot;
import com.platform.reconciler.snapshot.StateSyncManager;
import com.platform.reconciler.snapshot.SyncStatus;
import com.platform.reconciler.system.SystemManager;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for state snapshots.
 */
@RestController
@RequestMapping("/api/snapshots")
public class SnapshotController {
    
    private final StateSyncManager stateSync;
    private final SystemManager systemManager;
    
    public SnapshotController(StateSyncManager stateSync, SystemManager systemManager) {
        this.stateSync = stateSync;
        this.systemManager = systemManager;
    }
    
    @GetMapping
    public List<SnapshotInfo> list() {
        return stateSync.listSnapshots();
    }
    
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public StateSnapshot create() {
        return stateSync.createSnapshot();
    }
    
    @GetMapping("/{id}")
    public StateSnapshot get(@PathVariable String id) {
        return stateSync.loadSnapshot(id);
    }
    
    @PostMapping("/{id}/restore")
    public StateSnapshot restore(@PathVariable String id) {
        return stateSync.restoreSnapshot(id);
    }
    
    /**
     * Delete all but the newest {@code keep} snapshots.
     */
    @DeleteMapping
    public Map<String, Integer> cleanup(@RequestParam(required = false) Integer keep) {
        int removed = keep != null ? stateSync.cleanupSnapshots(keep) : stateSync.cleanupSnapshots();
        return Map.of("removed", removed);
    }
    
    /**
     * Drift between the last applied configuration and the live host.
     */
    @GetMapping("/sync-status")
    public SyncStatus syncStatus() {
        return stateSync.checkSync(systemManager.currentConfiguration());
    }
}
