package com.bdi.api.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.bdi.api.model.AircraftPosition;
import com.bdi.api.model.AircraftStats;
import com.bdi.api.model.AircraftSummary;
import com.bdi.pipeline.aggregate.AggregationEngine;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.FieldValue;
import com.bdi.pipeline.store.InMemoryRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AircraftQueryServiceTest {
  private static final Instant T0 = Instant.parse("2023-11-01T00:00:00Z");

  private InMemoryRecordStore store;
  private AircraftQueryService service;

  @BeforeEach
  void setUp() {
    MergeEngine mergeEngine = new MergeEngine();
    store = new InMemoryRecordStore(mergeEngine);
    AggregationEngine engine = new AggregationEngine(
        store, mergeEngine, Duration.ZERO, 0, Clock.systemUTC(), new SimpleMeterRegistry());
    service = new AircraftQueryService(store, engine);

    store.putBatch(List.of(
        record("a1b2c3", 10, Map.of(
            "lat", FieldValue.ofDouble(40.0),
            "lon", FieldValue.ofDouble(-73.0),
            "alt_baro", FieldValue.ofDouble(1200.0),
            "gs", FieldValue.ofDouble(150.0),
            "emergency", FieldValue.ofText("none"),
            "registration", FieldValue.ofText("N123AB"),
            "type", FieldValue.ofText("B738"))),
        record("a1b2c3", 0, Map.of(
            "lat", FieldValue.ofDouble(39.9),
            "lon", FieldValue.ofDouble(-73.1),
            "alt_baro", FieldValue.ofDouble(35000.0))),
        record("a1b2c3", 5, Map.of("gs", FieldValue.ofDouble(480.0))),
        record("a1b2c3", 3, Map.of(
            "alt_baro", FieldValue.ofDouble(40000.0),
            "emergency", FieldValue.ofText("squawk"))),
        record("4ca7b5", 0, Map.of(
            "lat", FieldValue.ofDouble(53.4),
            "lon", FieldValue.ofDouble(-6.2),
            "emergency", FieldValue.ofText("general"))),
        record("0a0b0c", 0, Map.of())));
  }

  @Test
  void listsPositionedAircraftByIcaoWithPaging() {
    assertThat(service.listAircraft(2, 0)).extracting(AircraftSummary::icao)
        .containsExactly("4ca7b5", "a1b2c3");
    assertThat(service.listAircraft(1, 1)).containsExactly(new AircraftSummary("a1b2c3", "N123AB", "B738"));
    assertThat(service.listAircraft(2, 1)).isEmpty();
    assertThat(service.listAircraft(1000, Integer.MAX_VALUE)).isEmpty();
  }

  @Test
  void aircraftWithoutAnyPositionIsNotListed() {
    assertThat(service.listAircraft(1000, 0)).extracting(AircraftSummary::icao).doesNotContain("0a0b0c");
    assertThat(service.latest("0a0b0c")).isPresent();
  }

  @Test
  void positionsAreTimeOrderedAndSkipRecordsWithoutPosition() {
    List<AircraftPosition> positions = service.positions("a1b2c3", 1000, 0);

    assertThat(positions).containsExactly(
        new AircraftPosition(T0.getEpochSecond(), 39.9, -73.1),
        new AircraftPosition(T0.getEpochSecond() + 10, 40.0, -73.0));
    assertThat(service.positions("a1b2c3", 1, 1)).containsExactly(
        new AircraftPosition(T0.getEpochSecond() + 10, 40.0, -73.0));
    assertThat(service.positions("ffffff", 10, 0)).isEmpty();
  }

  @Test
  void statsCoverPositionedObservationsOnly() {
    assertThat(service.stats("a1b2c3")).isEqualTo(new AircraftStats(35000.0, 150.0, false));
    assertThat(service.stats("4ca7b5")).isEqualTo(new AircraftStats(null, null, true));
    assertThat(service.stats("ffffff")).isEqualTo(AircraftStats.unknown());
  }

  @Test
  void latestStateIsMergedPerField() {
    assertThat(service.latest("a1b2c3")).hasValueSatisfying(state -> {
      assertThat(state.doubleValue("alt_baro")).isEqualTo(1200.0);
      assertThat(state.doubleValue("gs")).isEqualTo(150.0);
      assertThat(state.lastObservedAt()).isEqualTo(T0.plusSeconds(10));
    });
    assertThat(service.latest("")).isEmpty();
  }

  @Test
  void emergencyValuesOtherThanNoneCount() {
    assertThat(AircraftQueryService.isEmergency("squawk")).isTrue();
    assertThat(AircraftQueryService.isEmergency("NONE")).isFalse();
    assertThat(AircraftQueryService.isEmergency(" ")).isFalse();
    assertThat(AircraftQueryService.isEmergency(null)).isFalse();
  }

  private static CanonicalRecord record(String icao, long offsetSeconds, Map<String, FieldValue> fields) {
    return new CanonicalRecord(icao, T0.plusSeconds(offsetSeconds), new HashMap<>(fields), "batch-1", 1L);
  }
}
