package com.bdi.api.api;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.bdi.api.config.BdiProperties;
import com.bdi.pipeline.checkpoint.Checkpoint;
import com.bdi.pipeline.ingest.BatchState;
import com.bdi.pipeline.ingest.BatchSummary;
import com.bdi.pipeline.ingest.IngestionCoordinator;
import com.bdi.pipeline.ingest.IngestionReport;
import com.bdi.pipeline.normalize.ReasonCode;
import com.bdi.pipeline.normalize.Rejection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = IngestionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(IngestionControllerTest.Config.class)
class IngestionControllerTest {
  private static final Instant T0 = Instant.parse("2023-11-02T08:00:00Z");

  @TestConfiguration
  @EnableConfigurationProperties(BdiProperties.class)
  static class Config {}

  @Autowired private MockMvc mockMvc;

  @MockBean private IngestionCoordinator coordinator;

  @Test
  void run_usesFileLimitAsBatchCap() throws Exception {
    BatchSummary acknowledged = summary("20231101-000000Z-0", "0:0", BatchState.ACKNOWLEDGED);
    when(coordinator.ingest(5)).thenReturn(new IngestionReport(
        "readsb-hist:20231101", "0:0", "1:0", false, List.of(acknowledged)));

    mockMvc.perform(post("/api/v1/ingest/run").param("file_limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sourceId").value("readsb-hist:20231101"))
        .andExpect(jsonPath("$.checkpointCursor").value("1:0"))
        .andExpect(jsonPath("$.acknowledged").value(1))
        .andExpect(jsonPath("$.recordsPersisted").value(95))
        .andExpect(jsonPath("$.rejections").value(5))
        .andExpect(jsonPath("$.batches[0].state").value("ACKNOWLEDGED"))
        .andExpect(jsonPath("$.batches[0].rejections[0].reasonCode").value("INVALID_ENTITY_ID"));
  }

  @Test
  void run_defaultsToConfiguredBatchesPerRun() throws Exception {
    when(coordinator.ingest(100)).thenReturn(new IngestionReport("s", "0:0", "0:0", true, List.of()));

    mockMvc.perform(post("/api/v1/ingest/run"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.endOfStream").value(true));
    verify(coordinator).ingest(100);
  }

  @Test
  void run_rejectsNonPositiveFileLimit() throws Exception {
    mockMvc.perform(post("/api/v1/ingest/run").param("file_limit", "0"))
        .andExpect(status().isBadRequest());
    verify(coordinator, never()).ingest(0);
  }

  @Test
  void batches_listsRecentOrFailed() throws Exception {
    when(coordinator.recentBatches()).thenReturn(List.of(summary("b2", "1:0", BatchState.PERSISTED)));
    when(coordinator.failedBatches()).thenReturn(List.of(summary("b1", "0:0", BatchState.FAILED)));

    mockMvc.perform(get("/api/v1/ingest/batches"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].batchId").value("b2"));
    mockMvc.perform(get("/api/v1/ingest/batches").param("state", "failed"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].state").value("FAILED"));
    mockMvc.perform(get("/api/v1/ingest/batches").param("state", "running"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void cancel_reportsOutcome() throws Exception {
    when(coordinator.find("b3")).thenReturn(Optional.of(summary("b3", "2:0", BatchState.CANCELLED)));
    when(coordinator.cancel("b3")).thenReturn(true);
    when(coordinator.find("b1")).thenReturn(Optional.of(summary("b1", "0:0", BatchState.ACKNOWLEDGED)));
    when(coordinator.cancel("b1")).thenReturn(false);

    mockMvc.perform(post("/api/v1/ingest/batches/b3/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(true))
        .andExpect(jsonPath("$.state").value("CANCELLED"));
    mockMvc.perform(post("/api/v1/ingest/batches/b1/cancel"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.cancelled").value(false));
  }

  @Test
  void cancel_unknownBatchIs404() throws Exception {
    when(coordinator.find("nope")).thenReturn(Optional.empty());

    mockMvc.perform(post("/api/v1/ingest/batches/nope/cancel"))
        .andExpect(status().isNotFound());
    verify(coordinator, never()).cancel("nope");
  }

  @Test
  void checkpoint_returnsStoredWatermark() throws Exception {
    when(coordinator.checkpoint()).thenReturn(Optional.of(
        new Checkpoint("readsb-hist:20231101", "12:0", 12L, "20231101-000055Z-0", T0)));

    mockMvc.perform(get("/api/v1/ingest/checkpoint"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cursor").value("12:0"))
        .andExpect(jsonPath("$.version").value(12));
  }

  private static BatchSummary summary(String batchId, String cursor, BatchState state) {
    return new BatchSummary(
        batchId,
        cursor,
        null,
        1L,
        state,
        100,
        95,
        5,
        95,
        0,
        state == BatchState.FAILED ? "PERSISTING" : null,
        state == BatchState.FAILED ? "batch failed" : null,
        List.of(new Rejection(batchId, 3, ReasonCode.INVALID_ENTITY_ID, "hex=zz does not match")),
        T0,
        T0);
  }
}
