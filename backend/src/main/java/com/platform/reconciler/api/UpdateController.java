package com.platform.reconciler.api;

import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.notify.UpdateEvent;
import com.platform.reconciler.notify.UpdateNotifier;
import com.platform.reconciler.system.SystemManager;
import com.platform.reconciler.update.LiveUpdateManager;
import com.platform.reconciler.update.LiveUpdateResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for live updates.
 */
@RestController
@RequestMapping("/api/updates")
public class UpdateController {
    
    private final SystemManager systemManager;
    private final LiveUpdateManager liveUpdateManager;
    private final UpdateNotifier notifier;
    
    public UpdateController(
            SystemManager systemManager,
            LiveUpdateManager liveUpdateManager,
            UpdateNotifier notifier) {
        this.systemManager = systemManager;
        this.liveUpdateManager = liveUpdateManager;
        this.notifier = notifier;
    }
    
    /**
     * Reconcile the host to the desired configuration.
     * Reboot-blocked runs answer 409 and failed runs 422, both with the result body.
     */
    @PostMapping("/apply")
    public ResponseEntity<LiveUpdateResult> apply(@Valid @RequestBody ApiRequests.UpdateRequest request) {
        LiveUpdateResult result = systemManager.applyUpdate(request.getDesired(), request.effectiveOptions());
        return ResponseEntity.status(statusFor(result)).body(result);
    }
    
    @PostMapping("/preview")
    public ApiRequests.UpdatePreview preview(@RequestBody SystemConfiguration desired) {
        SystemConfiguration current = systemManager.currentConfiguration();
        return new ApiRequests.UpdatePreview(
            liveUpdateManager.previewChanges(current, desired),
            liveUpdateManager.canApplyLiveUpdates(current, desired));
    }
    
    @GetMapping("/history")
    public List<UpdateEvent> history(@RequestParam(defaultValue = "100") int limit) {
        return notifier.history(limit);
    }
    
    @GetMapping("/phase")
    public Map<String, Object> phase() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("phase", liveUpdateManager.currentPhase());
        body.put("running", liveUpdateManager.isRunning());
        liveUpdateManager.lastRun().ifPresent(run -> body.put("lastRun", run));
        return body;
    }
    
    static HttpStatus statusFor(LiveUpdateResult result) {
        if (result instanceof LiveUpdateResult.RebootRequired) {
            return HttpStatus.CONFLICT;
        }
        if (result instanceof LiveUpdateResult.Failed) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.OK;
    }
}
