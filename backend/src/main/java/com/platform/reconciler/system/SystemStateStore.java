package com.platform.reconciler.system;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.reconciler.error.StateSyncException;
import com.platform.reconciler.error.ValidationException;
import com.platform.reconciler.host.AtomicFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File-backed store for the {@link SystemStateRecord}.
 */
@Slf4j
@Component
public class SystemStateStore {

    private final ObjectMapper objectMapper;
    private final Path stateFile;

    public SystemStateStore(
            ObjectMapper objectMapper,
            @Value("${reconciler.state.system-state-file:/var/lib/horizonos/system-state.json}") Path stateFile) {
        this.objectMapper = objectMapper;
        this.stateFile = stateFile;
    }

    public Path path() {
        return stateFile;
    }

    public void save(SystemStateRecord record) {
        try {
            AtomicFiles.write(stateFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record));
            log.debug("System state written to {}", stateFile);
        } catch (IOException e) {
            throw new StateSyncException("Cannot write system state " + stateFile, e);
        }
    }

    public Optional<SystemStateRecord> load() {
        if (!Files.exists(stateFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(stateFile.toFile(), SystemStateRecord.class));
        } catch (IOException e) {
            throw new StateSyncException("Cannot read system state " + stateFile, e);
        }
    }

    public String toJson(SystemStateRecord record) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StateSyncException("Cannot serialize system state", e);
        }
    }

    /**
     * @throws ValidationException if the document is not a system state record
     */
    public SystemStateRecord fromJson(String json) {
        try {
            return objectMapper.readValue(json, SystemStateRecord.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("state", "not a valid system state document: " + e.getOriginalMessage());
        }
    }

    public void delete() {
        try {
            Files.deleteIfExists(stateFile);
        } catch (IOException e) {
            throw new StateSyncException("Cannot delete system state " + stateFile, e);
        }
    }
}
