package com.platform.reconciler.layer;

import com.platform.reconciler.error.CircularDependencyException;
import com.platform.reconciler.error.ValidationException;
import com.platform.reconciler.model.SystemLayer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dependency-ordered layer scheduling.
 *
 * <p>Repeatedly picks, among the layers whose dependencies have all been processed, the one
 * with the lowest priority, ties broken by declaration order. Every dependency must name a
 * layer in the given list.
 */
@Component
public class LayerOrderResolver {
    
    /**
     * @throws ValidationException if a dependency names a layer outside the list
     * @throws CircularDependencyException naming the layers that could never become ready
     */
    public List<SystemLayer> resolve(List<SystemLayer> layers) {
        Set<String> known = layers.stream().map(SystemLayer::name).collect(Collectors.toSet());
        for (SystemLayer layer : layers) {
            for (String dependency : layer.dependencies()) {
                if (!known.contains(dependency)) {
                    throw new ValidationException("layers.dependencies", dependency,
                        "layer " + layer.name() + " depends on a layer that does not exist");
                }
            }
        }
        List<SystemLayer> remaining = new ArrayList<>(layers);
        Set<String> processed = new HashSet<>();
        List<SystemLayer> ordered = new ArrayList<>(layers.size());
        
        while (!remaining.isEmpty()) {
            // min() keeps the first of equal elements, which preserves declaration order on ties
            Optional<SystemLayer> next = remaining.stream()
                .filter(layer -> processed.containsAll(layer.dependencies()))
                .min(Comparator.comparingInt(SystemLayer::priority));
            
            if (next.isEmpty()) {
                throw new CircularDependencyException(remaining.stream().map(SystemLayer::name).toList());
            }
            
            SystemLayer layer = next.get();
            ordered.add(layer);
            processed.add(layer.name());
            remaining.remove(layer);
        }
        
        return ordered;
    }
}
