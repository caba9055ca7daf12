package com.platform.reconciler.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.reconciler.error.ReconcilerException;
import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.error.StateSyncException;
import com.platform.reconciler.host.AtomicFiles;
import com.platform.reconciler.host.HostFacts;
import com.platform.reconciler.host.HostOperations;
import com.platform.reconciler.model.PackageSpec;
import com.platform.reconciler.model.ServiceSpec;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.model.UserSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps the durable "current state" record and takes and restores snapshots of it.
 *
 * <p>The record is the last applied {@link SystemConfiguration} as JSON in {@code current-config.json}.
 * A snapshot directory holds a byte copy of that file ({@code config.json}) and the host facts
 * observed at capture time ({@code snapshot.json}).
 */
@Slf4j
@Component
public class StateSyncManager {

    static final String CURRENT_CONFIG_FILE = "current-config.json";
    static final String SNAPSHOT_CONFIG_FILE = "config.json";
    static final String SNAPSHOT_META_FILE = "snapshot.json";
    static final String SNAPSHOT_PREFIX = "snapshot-";

    private static final DateTimeFormatter ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final HostOperations hostOperations;
    private final Path stateDir;
    private final Path snapshotDir;
    private final int defaultKeep;

    private final Map<String, Object> currentState = new LinkedHashMap<>();

    public StateSyncManager(
            ObjectMapper objectMapper,
            HostOperations hostOperations,
            @Value("${reconciler.state.dir:/var/lib/horizonos/state}") Path stateDir,
            @Value("${reconciler.state.snapshot-keep:10}") int defaultKeep) {
        this.objectMapper = objectMapper;
        this.hostOperations = hostOperations;
        this.stateDir = stateDir;
        this.snapshotDir = stateDir.resolve("snapshots");
        this.defaultKeep = defaultKeep;
    }

    // ==================== Current State ====================

    public Path currentConfigPath() {
        return stateDir.resolve(CURRENT_CONFIG_FILE);
    }

    /**
     * Last applied configuration, or empty when nothing has been applied yet.
     *
     * @throws StateSyncException if the record exists but cannot be read
     */
    public Optional<SystemConfiguration> currentConfiguration() {
        Path path = currentConfigPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), SystemConfiguration.class));
        } catch (IOException e) {
            throw new StateSyncException("Cannot read state record " + path, e);
        }
    }

    /**
     * Record the configuration as the new current state.
     */
    public synchronized void syncState(SystemConfiguration config) {
        try {
            AtomicFiles.write(currentConfigPath(), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(config));
        } catch (IOException e) {
            throw new StateSyncException("Cannot write state record " + currentConfigPath(), e);
        }

        currentState.put("lastSync", Instant.now().toString());
        currentState.put("configHash", Integer.toHexString(config.hashCode()));
        currentState.put("hostname", config.system().hostname());
        currentState.put("timezone", config.system().timezone());
        currentState.put("locale", config.system().locale());
        currentState.put("packages", config.packages().stream().filter(PackageSpec::isInstall).map(PackageSpec::name).toList());
        currentState.put("services", config.services().stream().map(ServiceSpec::name).toList());
        currentState.put("users", config.users().stream().map(UserSpec::name).toList());

        log.info("State synchronized: hostname={}, packages={}, services={}",
            config.system().hostname(), config.packages().size(), config.services().size());
    }

    public synchronized Map<String, Object> getCurrentState() {
        return Map.copyOf(currentState);
    }

    /**
     * Raw JSON of the state record, or null when nothing has been applied.
     */
    public String exportCurrentConfiguration() {
        Path path = currentConfigPath();
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new StateSyncException("Cannot read state record " + path, e);
        }
    }

    // ==================== Snapshots ====================

    /**
     * Copy the state record and capture host facts for the services it tracks.
     */
    public synchronized StateSnapshot createSnapshot() {
        Instant now = Instant.now();
        String id = uniqueId(now);
        Path dir = snapshotDir.resolve(id);
        Path current = currentConfigPath();

        Set<String> services = currentConfiguration()
            .map(config -> config.services().stream()
                .map(ServiceSpec::name)
                .collect(Collectors.toCollection(LinkedHashSet::new)))
            .orElseGet(LinkedHashSet::new);

        try {
            Files.createDirectories(dir);
            boolean hasConfig = Files.exists(current);
            if (hasConfig) {
                AtomicFiles.write(dir.resolve(SNAPSHOT_CONFIG_FILE), Files.readAllBytes(current));
            }

            HostFacts facts = hostOperations.captureFacts(services);
            StateSnapshot snapshot = new StateSnapshot(id, now, hasConfig, facts);
            AtomicFiles.write(dir.resolve(SNAPSHOT_META_FILE), objectMapper.writeValueAsBytes(snapshot));

            log.info("Created snapshot {} (config={}, services={})", id, hasConfig, services.size());
            return snapshot;
        } catch (IOException e) {
            throw new StateSyncException("Cannot create snapshot " + id, e);
        }
    }

    public StateSnapshot restoreSnapshot(String id) {
        return restoreSnapshot(loadSnapshot(id));
    }

    /**
     * Write the snapshot's state record back byte for byte and re-apply host facts that drifted.
     *
     * @throws StateSyncException if the snapshot is unreadable or a host fact cannot be restored
     */
    public synchronized StateSnapshot restoreSnapshot(StateSnapshot snapshot) {
        Path dir = snapshotDir.resolve(snapshot.id());
        Path current = currentConfigPath();

        try {
            if (snapshot.hasConfig()) {
                Path saved = dir.resolve(SNAPSHOT_CONFIG_FILE);
                if (!Files.exists(saved)) {
                    throw new StateSyncException("Snapshot files not found: " + snapshot.id());
                }
                AtomicFiles.write(current, Files.readAllBytes(saved));
            } else {
                Files.deleteIfExists(current);
            }
        } catch (IOException e) {
            throw new StateSyncException("Cannot restore state record from snapshot " + snapshot.id(), e);
        }

        try {
            restoreHostFacts(snapshot.hostFacts());
        } catch (ReconcilerException e) {
            throw new StateSyncException("Cannot restore host settings from snapshot " + snapshot.id(), e);
        }

        log.info("Restored snapshot {}", snapshot.id());
        return snapshot;
    }

    private void restoreHostFacts(HostFacts facts) {
        if (facts == null) {
            return;
        }
        if (!Objects.equals(hostOperations.currentHostname(), facts.hostname())) {
            hostOperations.setHostname(facts.hostname());
        }
        if (!Objects.equals(hostOperations.currentTimezone(), facts.timezone())) {
            hostOperations.setTimezone(facts.timezone());
        }
        if (!Objects.equals(hostOperations.currentLocale(), facts.locale())) {
            hostOperations.setLocale(facts.locale());
        }
        facts.serviceEnablement().forEach((service, enabled) -> {
            if (hostOperations.isServiceEnabled(service) != enabled) {
                if (enabled) {
                    hostOperations.enableService(service);
                } else {
                    hostOperations.disableService(service);
                }
            }
        });
    }

    public StateSnapshot loadSnapshot(String id) {
        Path meta = snapshotDir.resolve(id).resolve(SNAPSHOT_META_FILE);
        if (!id.startsWith(SNAPSHOT_PREFIX) || !Files.exists(meta)) {
            throw ResourceNotFoundException.snapshot(id);
        }
        try {
            return objectMapper.readValue(meta.toFile(), StateSnapshot.class);
        } catch (IOException e) {
            throw new StateSyncException("Cannot read snapshot " + id, e);
        }
    }

    /**
     * Snapshots on disk, newest first. Unreadable snapshot directories are skipped.
     */
    public List<SnapshotInfo> listSnapshots() {
        if (!Files.isDirectory(snapshotDir)) {
            return List.of();
        }
        List<SnapshotInfo> snapshots = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(snapshotDir)) {
            for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                String id = dir.getFileName().toString();
                if (!id.startsWith(SNAPSHOT_PREFIX)) {
                    continue;
                }
                try {
                    StateSnapshot snapshot = loadSnapshot(id);
                    snapshots.add(new SnapshotInfo(id, snapshot.createdAt(), sizeOf(dir), snapshot.hasConfig()));
                } catch (StateSyncException | ResourceNotFoundException e) {
                    log.warn("Skipping unreadable snapshot {}: {}", id, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StateSyncException("Cannot list snapshots in " + snapshotDir, e);
        }
        snapshots.sort(Comparator.comparing(SnapshotInfo::createdAt).thenComparing(SnapshotInfo::id).reversed());
        return snapshots;
    }

    public int cleanupSnapshots() {
        return cleanupSnapshots(defaultKeep);
    }

    /**
     * Delete all but the newest {@code keep} snapshots.
     *
     * @return number of snapshots deleted
     */
    public synchronized int cleanupSnapshots(int keep) {
        List<SnapshotInfo> snapshots = listSnapshots();
        if (snapshots.size() <= keep) {
            return 0;
        }
        int deleted = 0;
        for (SnapshotInfo snapshot : snapshots.subList(Math.max(keep, 0), snapshots.size())) {
            deleteRecursively(snapshotDir.resolve(snapshot.id()));
            deleted++;
        }
        log.info("Deleted {} old snapshots, kept {}", deleted, keep);
        return deleted;
    }

    // ==================== Sync Check ====================

    /**
     * Compare the live host with a configuration: hostname, service enablement and installed packages.
     */
    public SyncStatus checkSync(SystemConfiguration config) {
        List<SyncIssue> issues = new ArrayList<>();

        String hostname = hostOperations.currentHostname();
        if (!Objects.equals(hostname, config.system().hostname())) {
            issues.add(new SyncIssue("system", "hostname", config.system().hostname(), hostname));
        }

        for (ServiceSpec service : config.services()) {
            boolean enabled = hostOperations.isServiceEnabled(service.name());
            if (enabled != service.enabled()) {
                issues.add(new SyncIssue("service", service.name(),
                    String.valueOf(service.enabled()), String.valueOf(enabled)));
            }
        }

        List<PackageSpec> wanted = config.packages().stream().filter(PackageSpec::isInstall).toList();
        if (!wanted.isEmpty()) {
            Set<String> installed = hostOperations.installedPackages();
            for (PackageSpec pkg : wanted) {
                if (!installed.contains(pkg.name())) {
                    issues.add(new SyncIssue("package", pkg.name(), "installed", "not installed"));
                }
            }
        }

        return issues.isEmpty() ? SyncStatus.inSync() : SyncStatus.outOfSync(issues);
    }

    // ==================== Helpers ====================

    private String uniqueId(Instant now) {
        String base = SNAPSHOT_PREFIX + ID_FORMAT.format(now);
        String id = base;
        int suffix = 1;
        while (Files.exists(snapshotDir.resolve(id))) {
            id = base + "-" + suffix++;
        }
        return id;
    }

    private static long sizeOf(Path dir) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile).mapToLong(file -> file.toFile().length()).sum();
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new StateSyncException("Cannot delete snapshot " + dir.getFileName(), e);
        }
    }
}
