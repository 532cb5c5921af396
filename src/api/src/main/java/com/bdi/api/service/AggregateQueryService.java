package com.bdi.api.service;

import com.bdi.api.model.AircraftCount;
import com.bdi.api.model.AircraftStateResponse;
import com.bdi.api.model.CountsResponse;
import com.bdi.api.model.SnapshotResponse;
import com.bdi.pipeline.aggregate.AggregateKind;
import com.bdi.pipeline.aggregate.AggregateParams;
import com.bdi.pipeline.aggregate.CountsResult;
import com.bdi.pipeline.aggregate.QuerySink;
import com.bdi.pipeline.aggregate.SnapshotResult;
import com.bdi.pipeline.aggregate.TimeWindow;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Maps windowed aggregate queries onto the query sink and shapes the responses.
 */
@Service
public class AggregateQueryService {
  private final QuerySink querySink;

  public AggregateQueryService(QuerySink querySink) {
    this.querySink = querySink;
  }

  public CountsResponse counts(TimeWindow window, Set<String> icaos) {
    CountsResult result = (CountsResult) querySink.aggregate(
        AggregateKind.COUNT_PER_ENTITY, window, AggregateParams.none().forEntities(icaos));
    return toResponse(result);
  }

  /**
   * Returns the {@code k} aircraft with the most observations in the window, ties broken by
   * ICAO address ascending.
   *
   * @throws com.bdi.pipeline.error.InvalidQueryException when {@code k} is not positive
   */
  public CountsResponse topK(TimeWindow window, int k, Set<String> icaos) {
    CountsResult result = (CountsResult) querySink.aggregate(
        AggregateKind.TOP_K_BY_COUNT, window, AggregateParams.topK(k).forEntities(icaos));
    return toResponse(result);
  }

  public SnapshotResponse snapshot(TimeWindow window, Set<String> icaos) {
    SnapshotResult result = (SnapshotResult) querySink.aggregate(
        AggregateKind.LATEST_STATE_SNAPSHOT, window, AggregateParams.none().forEntities(icaos));
    return new SnapshotResponse(
        result.window().start().toString(),
        result.window().end().toString(),
        result.computedAt().toString(),
        result.states().size(),
        result.states().stream().map(AircraftStateResponse::from).toList());
  }

  private static CountsResponse toResponse(CountsResult result) {
    return new CountsResponse(
        result.kind().name(),
        result.window().start().toString(),
        result.window().end().toString(),
        result.computedAt().toString(),
        result.totalRecords(),
        result.counts().stream()
            .map(count -> new AircraftCount(count.entityId(), count.count()))
            .toList());
  }
}
