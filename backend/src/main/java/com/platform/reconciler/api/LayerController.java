package com.platform.reconciler.api;

import com.platform.reconciler.layer.LayerInfo;
import com.platform.reconciler.layer.LayerManager;
import com.platform.reconciler.layer.LayerOverview;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for deployed layers.
 */
@RestController
@RequestMapping("/api/layers")
public class LayerController {
    
    private final LayerManager layerManager;
    
    public LayerController(LayerManager layerManager) {
        this.layerManager = layerManager;
    }
    
    @GetMapping
    public List<LayerInfo> list() {
        return layerManager.listLayers();
    }
    
    @GetMapping("/overview")
    public LayerOverview overview() {
        return layerManager.layerOverview();
    }
    
    @GetMapping("/{name}")
    public LayerInfo get(@PathVariable String name) {
        return layerManager.getLayer(name);
    }
    
    @PostMapping("/{name}/start")
    public LayerInfo start(@PathVariable String name) {
        return layerManager.startLayer(name);
    }
    
    @PostMapping("/{name}/stop")
    public LayerInfo stop(@PathVariable String name) {
        return layerManager.stopLayer(name);
    }
    
    @DeleteMapping("/{name}")
    public ResponseEntity<Void> remove(@PathVariable String name) {
        layerManager.removeLayer(name);
        return ResponseEntity.noContent().build();
    }
}
