package com.platform.reconciler.container;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Point-in-time resource usage as reported by {@code <runtime> stats --no-stream}.
 * Values are kept as the runtime formats them, except the CPU and memory percentages.
 */
public record ContainerStats(
    String name,
    double cpuPercent,
    double memoryPercent,
    String memoryUsage,
    String networkIo,
    String blockIo,
    String pids
) {
    
    /**
     * Parse one stats entry. Podman uses snake_case keys, Docker uses CamelCase ones.
     */
    public static ContainerStats fromJson(String name, JsonNode node) {
        return new ContainerStats(
            name,
            percent(first(node, "cpu_percent", "CPUPerc", "CPU")),
            percent(first(node, "mem_percent", "MemPerc", "MEM")),
            first(node, "mem_usage", "MemUsage"),
            first(node, "net_io", "NetIO"),
            first(node, "block_io", "BlockIO"),
            first(node, "pids", "PIDs")
        );
    }
    
    private static String first(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
    
    private static double percent(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(raw.replace("%", "").trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
