package com.bdi.api.service;

import com.bdi.api.model.AircraftPosition;
import com.bdi.api.model.AircraftStats;
import com.bdi.api.model.AircraftSummary;
import com.bdi.pipeline.aggregate.QuerySink;
import com.bdi.pipeline.model.CanonicalRecord;
import com.bdi.pipeline.model.EntityState;
import com.bdi.pipeline.store.RecordStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Per-aircraft read paths over the record store.
 *
 * <p>Listings come from the entity states, which the store keeps ordered by ICAO address.
 * Positions and statistics scan the aircraft's records through the entity index.
 */
@Service
public class AircraftQueryService {
  static final Instant ALL_TIME_START = Instant.EPOCH;
  static final Instant ALL_TIME_END = Instant.ofEpochMilli(Long.MAX_VALUE);
  private static final int LISTING_CHUNK = 500;

  private final RecordStore store;
  private final QuerySink querySink;

  public AircraftQueryService(RecordStore store, QuerySink querySink) {
    this.store = store;
    this.querySink = querySink;
  }

  /**
   * Lists aircraft with at least one positioned observation, ordered by ICAO address ascending.
   *
   * @param numResults page size, already validated
   * @param page zero-based page index, already validated
   * @return one page of aircraft
   */
  public List<AircraftSummary> listAircraft(int numResults, int page) {
    long skip = (long) page * numResults;
    List<AircraftSummary> aircraft = new ArrayList<>();
    long seen = 0;
    int offset = 0;
    while (aircraft.size() < numResults) {
      List<EntityState> states = store.listStates(offset, LISTING_CHUNK);
      for (EntityState state : states) {
        if (!hasPosition(state.entityId()) || seen++ < skip) {
          continue;
        }
        aircraft.add(new AircraftSummary(
            state.entityId(),
            state.textValue("registration"),
            state.textValue("type")));
        if (aircraft.size() >= numResults) {
          break;
        }
      }
      if (states.size() < LISTING_CHUNK) {
        break;
      }
      offset += states.size();
    }
    return aircraft;
  }

  /**
   * Lists the known positions of one aircraft ordered by time ascending. Observations without a
   * latitude and longitude are skipped; an unknown aircraft yields an empty list.
   */
  public List<AircraftPosition> positions(String icao, int numResults, int page) {
    if (icao.isEmpty()) {
      return List.of();
    }
    long skip = (long) page * numResults;
    List<AircraftPosition> positions = new ArrayList<>();
    long seen = 0;
    for (CanonicalRecord record : store.queryEntity(icao, ALL_TIME_START, ALL_TIME_END)) {
      if (!isPositioned(record) || seen++ < skip) {
        continue;
      }
      positions.add(new AircraftPosition(
          record.observedAt().toEpochMilli() / 1000.0,
          record.doubleField("lat"),
          record.doubleField("lon")));
      if (positions.size() >= numResults) {
        break;
      }
    }
    return positions;
  }

  /**
   * Computes maximum barometric altitude, maximum ground speed and whether any observation
   * reported an emergency, over positioned observations only. Unknown aircraft yield nulls and
   * {@code false}.
   */
  public AircraftStats stats(String icao) {
    if (icao.isEmpty()) {
      return AircraftStats.unknown();
    }
    Double maxAltitude = null;
    Double maxSpeed = null;
    boolean emergency = false;
    for (CanonicalRecord record : store.queryEntity(icao, ALL_TIME_START, ALL_TIME_END)) {
      if (!isPositioned(record)) {
        continue;
      }
      maxAltitude = max(maxAltitude, record.doubleField("alt_baro"));
      maxSpeed = max(maxSpeed, record.doubleField("gs"));
      emergency = emergency || isEmergency(record.textField("emergency"));
    }
    return new AircraftStats(maxAltitude, maxSpeed, emergency);
  }

  public Optional<EntityState> latest(String icao) {
    return icao.isEmpty() ? Optional.empty() : querySink.getLatest(icao);
  }

  private boolean hasPosition(String icao) {
    for (CanonicalRecord record : store.queryEntity(icao, ALL_TIME_START, ALL_TIME_END)) {
      if (isPositioned(record)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isPositioned(CanonicalRecord record) {
    return record.doubleField("lat") != null && record.doubleField("lon") != null;
  }

  private static Double max(Double current, Double candidate) {
    if (candidate == null) {
      return current;
    }
    return current == null ? candidate : Math.max(current, candidate);
  }

  static boolean isEmergency(String value) {
    return value != null && !value.isBlank() && !"none".equalsIgnoreCase(value.trim());
  }
}
