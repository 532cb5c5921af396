package com.bdi.api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bdi.api.model.AircraftCount;
import com.bdi.api.model.CountsResponse;
import com.bdi.api.model.SnapshotResponse;
import com.bdi.pipeline.aggregate.AggregationEngine;
import com.bdi.pipeline.aggregate.TimeWindow;
import com.bdi.pipeline.error.InvalidQueryException;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.FieldValue;
import com.bdi.pipeline.store.InMemoryRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AggregateQueryServiceTest {
  private static final Instant T0 = Instant.parse("2023-11-01T00:00:00Z");
  private static final TimeWindow FIRST_MINUTE = TimeWindow.of(T0, T0.plusSeconds(60));

  private AggregateQueryService service;

  @BeforeEach
  void setUp() {
    MergeEngine mergeEngine = new MergeEngine();
    InMemoryRecordStore store = new InMemoryRecordStore(mergeEngine);
    List<CanonicalRecord> records = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      records.add(record("bbbbbb", i * 5));
      records.add(record("aaaaaa", i * 5));
    }
    records.add(record("cccccc", 0));
    records.add(record("cccccc", 60));
    store.putBatch(records);

    AggregationEngine engine = new AggregationEngine(
        store,
        mergeEngine,
        Duration.ofSeconds(5),
        16,
        Clock.fixed(T0.plusSeconds(120), ZoneOffset.UTC),
        new SimpleMeterRegistry());
    service = new AggregateQueryService(engine);
  }

  @Test
  void countsAreOrderedByIcaoAndRespectHalfOpenWindow() {
    CountsResponse response = service.counts(FIRST_MINUTE, Set.of());

    assertThat(response.kind()).isEqualTo("COUNT_PER_ENTITY");
    assertThat(response.totalRecords()).isEqualTo(7);
    assertThat(response.counts()).containsExactly(
        new AircraftCount("aaaaaa", 3),
        new AircraftCount("bbbbbb", 3),
        new AircraftCount("cccccc", 1));
    assertThat(response.from()).isEqualTo("2023-11-01T00:00:00Z");
    assertThat(response.to()).isEqualTo("2023-11-01T00:01:00Z");
  }

  @Test
  void topKBreaksTiesByIcao() {
    CountsResponse response = service.topK(FIRST_MINUTE, 2, Set.of());

    assertThat(response.counts()).containsExactly(
        new AircraftCount("aaaaaa", 3),
        new AircraftCount("bbbbbb", 3));
  }

  @Test
  void topKRejectsNonPositiveK() {
    assertThatThrownBy(() -> service.topK(FIRST_MINUTE, 0, Set.of()))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void snapshotIsLimitedToRequestedAircraft() {
    SnapshotResponse response = service.snapshot(FIRST_MINUTE, Set.of("bbbbbb"));

    assertThat(response.count()).isEqualTo(1);
    assertThat(response.aircraft()).singleElement().satisfies(state -> {
      assertThat(state.icao()).isEqualTo("bbbbbb");
      assertThat(state.lastSeen()).isEqualTo("2023-11-01T00:00:10Z");
      assertThat(state.fields()).containsEntry("gs", 10.0);
    });
  }

  private static CanonicalRecord record(String icao, int offsetSeconds) {
    return new CanonicalRecord(
        icao,
        T0.plusSeconds(offsetSeconds),
        Map.of("gs", FieldValue.ofDouble(offsetSeconds)),
        "batch-1",
        1L);
  }
}
