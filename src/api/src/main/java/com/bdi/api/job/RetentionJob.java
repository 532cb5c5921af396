package com.bdi.api.job;

import com.bdi.api.config.BdiProperties;
import com.bdi.pipeline.aggregate.AggregationEngine;
import com.bdi.pipeline.store.RecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Purges records and entity states older than {@code bdi.retention.max-age}.
 *
 * <p>Ages are measured against observation time, not ingestion time, so replaying an old day
 * with retention enabled purges it on the next cycle.
 */
@Component
@ConditionalOnProperty(prefix = "bdi.retention", name = "enabled", havingValue = "true")
public class RetentionJob {
  private static final Logger log = LoggerFactory.getLogger(RetentionJob.class);

  private final RecordStore store;
  private final AggregationEngine aggregationEngine;
  private final BdiProperties properties;
  private final Clock clock;
  private final Counter purgedCounter;

  public RetentionJob(
      RecordStore store,
      AggregationEngine aggregationEngine,
      BdiProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.aggregationEngine = aggregationEngine;
    this.properties = properties;
    this.clock = clock;
    this.purgedCounter = meterRegistry.counter("api.retention.purged");
  }

  @Scheduled(fixedDelayString = "${bdi.retention.interval-ms:3600000}")
  public void purge() {
    Instant cutoff = clock.instant().minus(properties.getRetention().getMaxAge());
    try {
      long purged = store.purgeBefore(cutoff);
      purgedCounter.increment(purged);
      if (purged > 0) {
        aggregationEngine.invalidate();
      }
      log.info("Retention purged {} records observed before {}", purged, cutoff);
    } catch (Exception ex) {
      log.error("Retention purge before {} failed", cutoff, ex);
    }
  }
}
