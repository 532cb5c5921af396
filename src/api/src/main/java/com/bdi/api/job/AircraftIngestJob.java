package com.bdi.api.job;

import com.bdi.api.config.BdiProperties;
import com.bdi.pipeline.ingest.BatchState;
import com.bdi.pipeline.ingest.IngestionCoordinator;
import com.bdi.pipeline.ingest.IngestionReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled ingestion loop. Each cycle runs one coordinator pass from the stored checkpoint.
 *
 * <p>Once the source reports end-of-stream the job keeps polling at the same interval, so a
 * source that grows (a local directory being filled) is picked up without a restart.
 */
@Component
public class AircraftIngestJob {
  private static final Logger log = LoggerFactory.getLogger(AircraftIngestJob.class);

  private final IngestionCoordinator coordinator;
  private final BdiProperties properties;
  private final Counter runCounter;
  private final Counter errorCounter;
  private final AtomicLong lastRunFailedBatches = new AtomicLong();

  public AircraftIngestJob(
      IngestionCoordinator coordinator, BdiProperties properties, MeterRegistry meterRegistry) {
    this.coordinator = coordinator;
    this.properties = properties;
    this.runCounter = meterRegistry.counter("api.ingest.runs");
    this.errorCounter = meterRegistry.counter("api.ingest.errors");
    meterRegistry.gauge("api.ingest.last_run.failed_batches", lastRunFailedBatches);
  }

  @Scheduled(
      fixedDelayString = "${bdi.ingest.interval-ms:60000}",
      initialDelayString = "${bdi.ingest.initial-delay-ms:5000}")
  public void ingest() {
    try {
      IngestionReport report = coordinator.ingest(properties.getIngest().getMaxBatchesPerRun());
      runCounter.increment();
      lastRunFailedBatches.set(report.count(BatchState.FAILED));
      if (!report.isSuccessful()) {
        log.warn(
            "Ingestion cycle for {} left {} failed and {} cancelled batches; checkpoint at {}",
            report.sourceId(),
            report.count(BatchState.FAILED),
            report.count(BatchState.CANCELLED),
            report.checkpointCursor());
      }
    } catch (Exception ex) {
      // Keep the scheduler running even if a cycle fails.
      errorCounter.increment();
      log.error("Ingestion cycle failed", ex);
    }
  }
}
