package com.platform.reconciler.container;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.reconciler.core.CircuitBreakerManager;
import com.platform.reconciler.error.CommandExecutionException;
import com.platform.reconciler.error.ContainerOperationException;
import com.platform.reconciler.error.ErrorCode;
import com.platform.reconciler.error.ResourceConflictException;
import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.host.CommandResult;
import com.platform.reconciler.host.CommandRunner;
import com.platform.reconciler.model.ContainerRuntime;
import com.platform.reconciler.model.ContainerSpec;
import com.platform.reconciler.model.ContainersConfig;
import com.platform.reconciler.observability.LogEventType;
import com.platform.reconciler.observability.LoggingConfig;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.observability.StructuredLogger;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the container registry and drives the container runtimes.
 *
 * <p>The registry is guarded by a single lock. A name being created or removed is reserved
 * for the duration of the runtime calls, so create and remove on one name never interleave.
 */
@Slf4j
@Component
public class ContainerManager {

    private static final String SHIM_TEMPLATE = "#!/bin/bash\nexec %s exec %s %s \"$@\"\n";

    private final CommandRunner commandRunner;
    private final CircuitBreakerManager circuitBreakers;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Duration commandTimeout;
    private final Duration packageTimeout;
    private final Path exportDir;
    private final ContainerRuntime defaultRuntime;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, ContainerInfo> registry = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();
    // shim file name -> container it forwards into
    private final Map<String, String> shimOwners = new HashMap<>();

    public ContainerManager(
            CommandRunner commandRunner,
            CircuitBreakerManager circuitBreakers,
            ObjectMapper objectMapper,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            @Value("${reconciler.command.timeout:PT2M}") Duration commandTimeout,
            @Value("${reconciler.command.package-timeout:PT30M}") Duration packageTimeout,
            @Value("${reconciler.containers.export-dir:/usr/local/bin}") Path exportDir,
            @Value("${reconciler.containers.default-runtime:PODMAN}") ContainerRuntime defaultRuntime) {
        this.commandRunner = commandRunner;
        this.circuitBreakers = circuitBreakers;
        this.objectMapper = objectMapper;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.commandTimeout = commandTimeout;
        this.packageTimeout = packageTimeout;
        this.exportDir = exportDir;
        this.defaultRuntime = defaultRuntime;
    }

    // ==================== Deployment ====================

    /**
     * Create every declared container, start the auto-start ones and export their binaries.
     * A container that fails is logged and skipped.
     */
    public List<ContainerInfo> deployContainers(ContainersConfig config) {
        List<ContainerInfo> deployed = new ArrayList<>();

        for (ContainerSpec spec : config.containers()) {
            ContainerSpec resolved = spec.runtime() != null ? spec : spec.toBuilder().runtime(config.defaultRuntime()).build();
            try {
                create(resolved, config.globalMounts());
                if (resolved.autoStart() || config.autoStart()) {
                    start(resolved.name());
                }
                exportBinaries(resolved);
                deployed.add(get(resolved.name()).orElseThrow());
            } catch (ContainerOperationException | ResourceConflictException e) {
                log.error("Failed to deploy container {}: {}", resolved.name(), e.getMessage());
            }
        }

        return deployed;
    }

    // ==================== Lifecycle ====================

    public ContainerInfo create(ContainerSpec spec) {
        return create(spec, List.of());
    }

    /**
     * Create a container, install its packages and run its setup commands.
     *
     * @param globalMounts volumes mounted into every container, ahead of the spec's own
     * @throws ResourceConflictException if the name is already registered
     * @throws ContainerOperationException naming the sub-step that failed
     */
    public ContainerInfo create(ContainerSpec spec, List<String> globalMounts) {
        ContainerRuntime runtime = spec.runtimeOr(defaultRuntime);
        String name = spec.name();
        long startTime = System.currentTimeMillis();

        reserve(name, true);
        LoggingConfig.setOperationContext("container.create", name);
        try {
            List<String> mounts = new ArrayList<>(new LinkedHashSet<>(concat(globalMounts, spec.persistent())));

            CommandResult created = runtimeCall(runtime, name, "create", buildCreateCommand(spec, runtime, mounts), commandTimeout);
            ContainerInfo info = new ContainerInfo(
                created.trimmedOutput(),
                name,
                spec.imageReference(),
                runtime,
                ContainerStatus.CREATED,
                Instant.now(),
                spec.ports(),
                mounts,
                List.of());
            register(info);

            try {
                for (String command : spec.preCommands()) {
                    runtimeCall(runtime, name, "pre-command", execCommand(runtime, name, command), commandTimeout);
                }
                if (!spec.packages().isEmpty()) {
                    List<String> install = new ArrayList<>(runtime.packageInstallCommand());
                    install.addAll(spec.packages());
                    runtimeCall(runtime, name, "install-packages", execCommand(runtime, name, String.join(" ", install)), packageTimeout);
                }
                for (String command : spec.postCommands()) {
                    runtimeCall(runtime, name, "post-command", execCommand(runtime, name, command), commandTimeout);
                }
            } catch (ContainerOperationException e) {
                updateStatus(name, ContainerStatus.ERROR);
                throw e;
            }

            long duration = System.currentTimeMillis() - startTime;
            structuredLogger.container().lifecycle(LogEventType.CONTAINER_CREATED, name, runtime.command(), duration);
            metricsRegistry.recordLatency("container", "create", duration);
            log.info("Created container {} from {} in {}ms", name, spec.imageReference(), duration);
            return get(name).orElseThrow();
        } finally {
            release(name);
            LoggingConfig.clearOperationContext();
        }
    }

    public void start(String name) {
        ContainerInfo info = require(name);
        long startTime = System.currentTimeMillis();
        runtimeCall(info.runtime(), name, "start", List.of(info.runtime().command(), "start", name), commandTimeout);
        updateStatus(name, ContainerStatus.RUNNING);
        structuredLogger.container().lifecycle(LogEventType.CONTAINER_STARTED, name,
            info.runtime().command(), System.currentTimeMillis() - startTime);
    }

    public void stop(String name) {
        ContainerInfo info = require(name);
        long startTime = System.currentTimeMillis();
        runtimeCall(info.runtime(), name, "stop", List.of(info.runtime().command(), "stop", name), commandTimeout);
        updateStatus(name, ContainerStatus.STOPPED);
        structuredLogger.container().lifecycle(LogEventType.CONTAINER_STOPPED, name,
            info.runtime().command(), System.currentTimeMillis() - startTime);
    }

    /**
     * Remove a container and the binary shims exported from it.
     */
    public void remove(String name, boolean force) {
        ContainerInfo info = require(name);
        long startTime = System.currentTimeMillis();

        reserve(name, false);
        try {
            List<String> command = new ArrayList<>(List.of(info.runtime().command(), "rm"));
            if (force) {
                command.add("-f");
            }
            command.add(name);
            runtimeCall(info.runtime(), name, "remove", command, commandTimeout);

            deleteShims(name, require(name).exportedBinaries());
            registryLock.lock();
            try {
                registry.remove(name);
                metricsRegistry.updateRegisteredContainers(registry.size());
            } finally {
                registryLock.unlock();
            }
        } finally {
            release(name);
        }

        structuredLogger.container().lifecycle(LogEventType.CONTAINER_REMOVED, name,
            info.runtime().command(), System.currentTimeMillis() - startTime);
    }

    /**
     * Force-remove every registered container. Failures are logged and the rest are still removed.
     *
     * @return number of containers removed
     */
    public int cleanup() {
        int removed = 0;
        for (ContainerInfo info : list()) {
            try {
                remove(info.name(), true);
                removed++;
            } catch (ContainerOperationException | ResourceConflictException e) {
                log.warn("Cleanup could not remove container {}: {}", info.name(), e.getMessage());
            }
        }
        log.info("Cleaned up {} containers", removed);
        return removed;
    }

    // ==================== Queries ====================

    /**
     * Ask the runtime for the container's state. A failing inspect marks the container ERROR.
     */
    public ContainerStatus status(String name) {
        ContainerInfo info = require(name);
        List<String> command = List.of(info.runtime().command(), "inspect", "--format", "{{.State.Status}}", name);

        ContainerStatus status;
        try {
            status = ContainerStatus.fromRuntimeState(
                runtimeCall(info.runtime(), name, "inspect", command, commandTimeout).trimmedOutput());
        } catch (ContainerOperationException e) {
            log.warn("Inspect failed for container {}: {}", name, e.getMessage());
            status = ContainerStatus.ERROR;
        }
        updateStatus(name, status);
        return status;
    }

    public HealthStatus healthCheck(String name) {
        return HealthStatus.fromContainerStatus(status(name));
    }

    public ContainerStats stats(String name) {
        ContainerInfo info = require(name);
        List<String> command = List.of(info.runtime().command(), "stats", "--format", "json", "--no-stream", name);
        String output = runtimeCall(info.runtime(), name, "stats", command, commandTimeout).trimmedOutput();

        try {
            JsonNode node = objectMapper.readTree(output);
            if (node.isArray()) {
                if (node.isEmpty()) {
                    throw new ContainerOperationException(name, "stats", "runtime returned no stats", null);
                }
                node = node.get(0);
            }
            return ContainerStats.fromJson(name, node);
        } catch (JsonProcessingException e) {
            throw new ContainerOperationException(name, "stats", "unparseable stats output", e);
        }
    }

    /**
     * Run a shell command inside the container. The result is returned whatever the exit code.
     */
    public CommandResult exec(String name, String command) {
        ContainerInfo info = require(name);
        try {
            return circuitBreakers.execute(info.runtime(),
                () -> commandRunner.run(execCommand(info.runtime(), name, command), commandTimeout));
        } catch (CallNotPermittedException e) {
            throw ContainerOperationException.runtimeUnavailable(name, info.runtime().command(), e);
        }
    }

    public String logs(String name, int tail) {
        ContainerInfo info = require(name);
        List<String> command = List.of(info.runtime().command(), "logs", "--tail", String.valueOf(tail), name);
        return runtimeCall(info.runtime(), name, "logs", command, commandTimeout).stdout();
    }

    public List<ContainerInfo> list() {
        registryLock.lock();
        try {
            return registry.values().stream()
                .sorted(Comparator.comparing(ContainerInfo::name))
                .toList();
        } finally {
            registryLock.unlock();
        }
    }

    public Optional<ContainerInfo> get(String name) {
        registryLock.lock();
        try {
            return Optional.ofNullable(registry.get(name));
        } finally {
            registryLock.unlock();
        }
    }

    public boolean isRuntimeAvailable(ContainerRuntime runtime) {
        try {
            return commandRunner.run(List.of(runtime.command(), "--version"), Duration.ofSeconds(5)).isSuccess();
        } catch (CommandExecutionException e) {
            log.debug("Runtime {} not available: {}", runtime.command(), e.getMessage());
            return false;
        }
    }

    public ContainerRuntime defaultRuntime() {
        return defaultRuntime;
    }

    // ==================== Binary Export ====================

    /**
     * Write a host shim for each declared binary that forwards into the container.
     * A shim name is a plain file name and belongs to one container at a time.
     *
     * @throws ResourceConflictException if another container already exports one of the binaries
     * @throws ContainerOperationException for an unusable binary name or a write failure
     */
    public List<Path> exportBinaries(ContainerSpec spec) {
        if (spec.binaries().isEmpty()) {
            return List.of();
        }
        ContainerRuntime runtime = spec.runtimeOr(defaultRuntime);
        for (String binary : spec.binaries()) {
            if (!isPlainFileName(binary)) {
                throw new ContainerOperationException(spec.name(), "export-binaries",
                    "Binary name must be a plain file name: " + binary, null);
            }
        }

        registryLock.lock();
        try {
            for (String binary : spec.binaries()) {
                String owner = shimOwners.get(binary);
                if (owner != null && !owner.equals(spec.name())) {
                    throw ResourceConflictException.binaryExported(binary, owner);
                }
            }
            spec.binaries().forEach(binary -> shimOwners.put(binary, spec.name()));
        } finally {
            registryLock.unlock();
        }

        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(exportDir);
            for (String binary : spec.binaries()) {
                Path shim = exportDir.resolve(binary);
                Files.writeString(shim, String.format(SHIM_TEMPLATE, runtime.command(), spec.name(), binary), StandardCharsets.UTF_8);
                Files.setPosixFilePermissions(shim, PosixFilePermissions.fromString("rwxr-xr-x"));
                written.add(shim);
            }
        } catch (IOException | UnsupportedOperationException e) {
            throw new ContainerOperationException(spec.name(), "export-binaries", e.getMessage(), e);
        }

        registryLock.lock();
        try {
            ContainerInfo info = registry.get(spec.name());
            if (info != null) {
                registry.put(spec.name(), info.withExportedBinaries(spec.binaries()));
            }
        } finally {
            registryLock.unlock();
        }

        log.info("Exported {} binaries from container {}", written.size(), spec.name());
        return written;
    }

    public static boolean isPlainFileName(String binary) {
        return binary != null && !binary.isBlank()
            && !binary.equals(".") && !binary.equals("..")
            && binary.indexOf('/') < 0 && binary.indexOf('\\') < 0;
    }

    /**
     * Delete the shims still owned by the container. Shims taken over by another container stay.
     */
    private void deleteShims(String containerName, List<String> binaries) {
        for (String binary : binaries) {
            registryLock.lock();
            try {
                if (!containerName.equals(shimOwners.get(binary))) {
                    continue;
                }
                shimOwners.remove(binary);
            } finally {
                registryLock.unlock();
            }
            try {
                Files.deleteIfExists(exportDir.resolve(binary));
            } catch (IOException e) {
                log.warn("Could not delete binary shim {}: {}", binary, e.getMessage());
            }
        }
    }

    // ==================== Helpers ====================

    private List<String> buildCreateCommand(ContainerSpec spec, ContainerRuntime runtime, List<String> mounts) {
        List<String> command = new ArrayList<>(List.of(runtime.command(), "create", "--name", spec.name()));

        if (spec.hostname() != null) {
            command.addAll(List.of("--hostname", spec.hostname()));
        }
        if (spec.user() != null) {
            command.addAll(List.of("--user", spec.user()));
        }
        if (spec.workingDir() != null) {
            command.addAll(List.of("--workdir", spec.workingDir()));
        }
        spec.environment().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> command.addAll(List.of("--env", e.getKey() + "=" + e.getValue())));
        spec.ports().forEach(port -> command.addAll(List.of("--publish", port)));
        mounts.forEach(mount -> command.addAll(List.of("--volume", mount)));
        spec.labels().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> command.addAll(List.of("--label", e.getKey() + "=" + e.getValue())));
        if (!"bridge".equals(spec.networkMode())) {
            command.addAll(List.of("--network", spec.networkMode()));
        }
        if (spec.privileged()) {
            command.add("--privileged");
        }
        command.add(spec.imageReference());

        return command;
    }

    private static List<String> execCommand(ContainerRuntime runtime, String name, String shellCommand) {
        return List.of(runtime.command(), "exec", name, "sh", "-c", shellCommand);
    }

    private CommandResult runtimeCall(ContainerRuntime runtime, String name, String step,
                                      List<String> command, Duration timeout) {
        Supplier<CommandResult> call = () -> commandRunner.runChecked(command, timeout);
        try {
            CommandResult result = circuitBreakers.execute(runtime, call);
            metricsRegistry.recordContainerOperation(runtime.command(), step, true);
            return result;
        } catch (CallNotPermittedException e) {
            metricsRegistry.recordContainerOperation(runtime.command(), step, false);
            throw ContainerOperationException.runtimeUnavailable(name, runtime.command(), e);
        } catch (CommandExecutionException e) {
            metricsRegistry.recordContainerOperation(runtime.command(), step, false);
            structuredLogger.container().operationFailed(name, step, e.getErrorCode().getCode(), e.getMessage());
            throw new ContainerOperationException(name, step, e.getMessage(), e);
        }
    }

    private ContainerInfo require(String name) {
        return get(name).orElseThrow(() -> ResourceNotFoundException.container(name));
    }

    private void register(ContainerInfo info) {
        registryLock.lock();
        try {
            registry.put(info.name(), info);
            metricsRegistry.updateRegisteredContainers(registry.size());
        } finally {
            registryLock.unlock();
        }
    }

    private void updateStatus(String name, ContainerStatus status) {
        registryLock.lock();
        try {
            registry.computeIfPresent(name, (key, info) -> info.withStatus(status));
        } finally {
            registryLock.unlock();
        }
    }

    private void reserve(String name, boolean mustBeAbsent) {
        registryLock.lock();
        try {
            if (inFlight.contains(name)) {
                throw new ResourceConflictException(ErrorCode.RESOURCE_CONFLICT, name,
                    "Another operation is in progress on container " + name);
            }
            if (mustBeAbsent && registry.containsKey(name)) {
                throw ResourceConflictException.duplicateContainer(name);
            }
            inFlight.add(name);
        } finally {
            registryLock.unlock();
        }
    }

    private void release(String name) {
        registryLock.lock();
        try {
            inFlight.remove(name);
        } finally {
            registryLock.unlock();
        }
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
