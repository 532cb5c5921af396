package com.bdi.api.api;

import com.bdi.api.config.BdiProperties;
import com.bdi.api.model.IngestionRunResponse;
import com.bdi.api.service.QueryParser;
import com.bdi.pipeline.checkpoint.Checkpoint;
import com.bdi.pipeline.ingest.BatchSummary;
import com.bdi.pipeline.ingest.IngestionCoordinator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Control endpoints for the ingestion pipeline: trigger a run, inspect batches and cancel one.
 */
@RestController
@RequestMapping("/api/v1/ingest")
public class IngestionController {
  private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

  private final IngestionCoordinator coordinator;
  private final BdiProperties properties;

  public IngestionController(IngestionCoordinator coordinator, BdiProperties properties) {
    this.coordinator = coordinator;
    this.properties = properties;
  }

  /**
   * Runs one ingestion pass from the stored checkpoint and waits for it to finish.
   *
   * <p>{@code file_limit} caps the number of batches fetched; a snapshot file is one batch unless
   * it holds more aircraft than the configured batch size.
   *
   * @param fileLimit optional batch cap, defaults to {@code bdi.ingest.max-batches-per-run}
   * @return run report
   */
  @PostMapping("/run")
  public IngestionRunResponse run(@RequestParam(name = "file_limit", required = false) String fileLimit) {
    int maxBatches = QueryParser.parsePositive(
        fileLimit,
        "file_limit",
        properties.getIngest().getMaxBatchesPerRun(),
        properties.getApi().getMaxBatchesPerRequest());
    log.info("Ingestion run requested: maxBatches={}", maxBatches);
    return IngestionRunResponse.from(coordinator.ingest(maxBatches));
  }

  /** Most recent batches, newest first. */
  @GetMapping("/batches")
  public List<BatchSummary> batches(@RequestParam(name = "state", required = false) String state) {
    if (state == null || state.isBlank()) {
      return coordinator.recentBatches();
    }
    if ("failed".equalsIgnoreCase(state.trim())) {
      return coordinator.failedBatches();
    }
    throw new BadRequestException("state must be one of: failed");
  }

  @GetMapping("/batches/{id}")
  public BatchSummary batch(@PathVariable String id) {
    return coordinator.find(id).orElseThrow(() -> new NotFoundException("batch not found: " + id));
  }

  /**
   * Cancels a batch that has not started merging.
   *
   * @param id batch id, or the cursor of a batch still being fetched
   * @return {@code 200} with the batch when cancelled, {@code 409} when it is too late
   */
  @PostMapping("/batches/{id}/cancel")
  public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
    if (coordinator.find(id).isEmpty()) {
      throw new NotFoundException("batch not found: " + id);
    }
    boolean cancelled = coordinator.cancel(id);
    HttpStatus status = cancelled ? HttpStatus.OK : HttpStatus.CONFLICT;
    return ResponseEntity.status(status).body(Map.of(
        "batch", id,
        "cancelled", cancelled,
        "state", coordinator.find(id).map(summary -> summary.state().name()).orElse("UNKNOWN")));
  }

  @GetMapping("/checkpoint")
  public Checkpoint checkpoint() {
    return coordinator.checkpoint()
        .orElseThrow(() -> new NotFoundException("no checkpoint for source " + coordinator.sourceId()));
  }
}
