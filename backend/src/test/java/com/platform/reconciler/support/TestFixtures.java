package com.platform.reconciler.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.reconciler.change.UpdatePolicy;
import com.platform.reconciler.container.ContainerManager;
import com.platform.reconciler.core.CircuitBreakerManager;
import com.platform.reconciler.host.CommandRunner;
import com.platform.reconciler.host.HostOperations;
import com.platform.reconciler.model.ContainerRuntime;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Hand-wired collaborators for unit tests.
 */
public final class TestFixtures {

    public static final List<String> RELOADABLE = List.of(
        "nginx", "apache2", "httpd", "postfix", "dovecot", "bind9", "named", "sshd",
        "NetworkManager", "systemd-resolved", "systemd-timesyncd");

    private TestFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static UpdatePolicy policy() {
        return new UpdatePolicy(RELOADABLE);
    }

    public static MetricsRegistry metrics() {
        return new MetricsRegistry(new SimpleMeterRegistry());
    }

    public static HostOperations host(CommandRunner runner, Path root) {
        return new HostOperations(runner, objectMapper(), Duration.ofSeconds(5), Duration.ofSeconds(5),
            root.resolve("repos.conf"), root.resolve("automation"));
    }

    public static CircuitBreakerManager circuitBreakers(MetricsRegistry metrics) {
        CircuitBreakerManager manager = new CircuitBreakerManager(CircuitBreakerRegistry.ofDefaults(), metrics);
        manager.init();
        return manager;
    }

    public static ContainerManager containerManager(CommandRunner runner, Path exportDir) {
        MetricsRegistry metrics = metrics();
        return new ContainerManager(runner, circuitBreakers(metrics), objectMapper(), metrics, new StructuredLogger(),
            Duration.ofSeconds(5), Duration.ofSeconds(5), exportDir, ContainerRuntime.PODMAN);
    }
}
