package com.bdi.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.bdi.api.model.AircraftPosition;
import com.bdi.api.model.AircraftStats;
import com.bdi.api.model.AircraftSummary;
import com.bdi.api.service.AircraftQueryService;
import com.bdi.api.source.LocalReadsbSource;
import com.bdi.api.source.ReadsbSnapshotParser;
import com.bdi.pipeline.aggregate.AggregationEngine;
import com.bdi.pipeline.checkpoint.InMemoryCheckpointStore;
import com.bdi.pipeline.ingest.BatchState;
import com.bdi.pipeline.ingest.IngestionCoordinator;
import com.bdi.pipeline.ingest.IngestionReport;
import com.bdi.pipeline.ingest.PipelineConfig;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.normalize.RecordNormalizer;
import com.bdi.pipeline.normalize.RecordSchema;
import com.bdi.pipeline.store.InMemoryRecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Local snapshot files through the whole pipeline into the per-aircraft read paths. */
class SnapshotIngestionFlowTest {

  @TempDir
  Path dir;

  private IngestionCoordinator coordinator;
  private AircraftQueryService queries;

  @BeforeEach
  void setUp() throws Exception {
    Files.writeString(dir.resolve("000000Z.json"), """
        {"now": 1698796800, "aircraft": [
          {"hex": "4ca7b5", "r": "EI-ABC", "t": "B738", "lat": 50.0, "lon": 4.0, "alt_baro": 30000, "gs": 400.5},
          {"hex": "a1b2c3", "lat": 51.0, "lon": 5.0, "alt_baro": "ground"},
          {"hex": "zz", "lat": 52.0, "lon": 6.0}
        ]}
        """);
    Files.writeString(dir.resolve("000005Z.json"), """
        {"now": 1698796805, "aircraft": [
          {"hex": "4ca7b5", "lat": 50.1, "lon": 4.1, "alt_baro": 31000, "gs": 410.0, "emergency": "general"}
        ]}
        """);

    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MergeEngine mergeEngine = new MergeEngine();
    InMemoryRecordStore store = new InMemoryRecordStore(mergeEngine);
    PipelineConfig config = new PipelineConfig(
        100, 2, Duration.ZERO, Duration.ofSeconds(5), Duration.ofSeconds(5),
        Duration.ZERO, Duration.ZERO, 2, 2, 1);
    LocalReadsbSource source = new LocalReadsbSource(
        dir, new ReadsbSnapshotParser(new ObjectMapper()), LocalDate.of(2023, 11, 1), 100, 100,
        Clock.systemUTC());
    coordinator = new IngestionCoordinator(
        source,
        new RecordNormalizer(RecordSchema.readsb(), registry),
        mergeEngine,
        store,
        new InMemoryCheckpointStore(),
        config,
        registry);
    AggregationEngine aggregationEngine =
        new AggregationEngine(store, mergeEngine, Duration.ZERO, 0, Clock.systemUTC(), registry);
    queries = new AircraftQueryService(store, aggregationEngine);
  }

  @AfterEach
  void tearDown() {
    coordinator.close();
  }

  @Test
  void ingestsDayAndServesAircraftViews() {
    IngestionReport report = coordinator.ingest(10);

    assertThat(report.endOfStream()).isTrue();
    assertThat(report.count(BatchState.ACKNOWLEDGED)).isEqualTo(2);
    assertThat(report.recordsFetched()).isEqualTo(4);
    assertThat(report.recordsPersisted()).isEqualTo(3);
    assertThat(report.rejections()).isEqualTo(1);
    assertThat(coordinator.checkpoint()).hasValueSatisfying(
        checkpoint -> assertThat(checkpoint.cursor()).isEqualTo("2:0"));

    assertThat(queries.listAircraft(10, 0))
        .extracting(AircraftSummary::icao)
        .containsExactly("4ca7b5", "a1b2c3");
    assertThat(queries.listAircraft(10, 0).get(0).registration()).isEqualTo("EI-ABC");

    List<AircraftPosition> positions = queries.positions("4ca7b5", 10, 0);
    assertThat(positions).extracting(AircraftPosition::timestamp)
        .containsExactly(1698796800.0, 1698796805.0);

    AircraftStats stats = queries.stats("4ca7b5");
    assertThat(stats.maxAltitudeBaro()).isEqualTo(31000.0);
    assertThat(stats.maxGroundSpeed()).isEqualTo(410.0);
    assertThat(stats.hadEmergency()).isTrue();
    assertThat(queries.stats("a1b2c3").maxAltitudeBaro()).isNull();
  }

  @Test
  void rerunFromCheckpointAddsNothing() {
    coordinator.ingest(10);

    IngestionReport rerun = coordinator.ingest(10);

    assertThat(rerun.endOfStream()).isTrue();
    assertThat(rerun.batches()).isEmpty();
    assertThat(queries.positions("4ca7b5", 10, 0)).hasSize(2);
  }
}
