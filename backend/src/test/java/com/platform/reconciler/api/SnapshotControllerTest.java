package com.platform.reconciler.api;

import com.platform.reconciler.error.ResourceNotFoundException;
import com.platform.reconciler.host.HostFacts;
import com.platform.reconciler.model.SystemConfiguration;
import com.platform.reconciler.observability.MetricsRegistry;
import com.platform.reconciler.snapshot.StateSnapshot;
import com.platform.reconciler.snapshot.StateSyncManager;
import com.platform.reconciler.snapshot.SyncIssue;
import com.platform.reconciler.snapshot.SyncStatus;
import com.platform.reconciler.system.SystemManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SnapshotController.class)
class SnapshotControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    StateSyncManager stateSync;

    @MockBean
    SystemManager systemManager;

    @MockBean
    MetricsRegistry metricsRegistry;

    @Test
    void createAnswersCreated() throws Exception {
        when(stateSync.createSnapshot()).thenReturn(new StateSnapshot("snapshot-20260101-000000-000",
            Instant.parse("2026-01-01T00:00:00Z"), true, new HostFacts("box", "UTC", "C.UTF-8", Map.of())));

        mockMvc.perform(post("/api/snapshots"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("snapshot-20260101-000000-000"))
            .andExpect(jsonPath("$.hostFacts.hostname").value("box"));
    }

    @Test
    void restoringUnknownSnapshotIsNotFound() throws Exception {
        when(stateSync.restoreSnapshot("snapshot-x")).thenThrow(ResourceNotFoundException.snapshot("snapshot-x"));

        mockMvc.perform(post("/api/snapshots/snapshot-x/restore"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CP-303"));
    }

    @Test
    void cleanupUsesRequestedKeep() throws Exception {
        when(stateSync.cleanupSnapshots(2)).thenReturn(4);

        mockMvc.perform(delete("/api/snapshots").param("keep", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(4));
    }

    @Test
    void syncStatusComparesRecordedConfiguration() throws Exception {
        SystemConfiguration recorded = SystemConfiguration.empty();
        when(systemManager.currentConfiguration()).thenReturn(recorded);
        when(stateSync.checkSync(recorded)).thenReturn(
            SyncStatus.outOfSync(List.of(new SyncIssue("system", "hostname", "horizonos", "other"))));

        mockMvc.perform(get("/api/snapshots/sync-status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.inSync").value(false))
            .andExpect(jsonPath("$.issues[0].actual").value("other"));
    }
}
