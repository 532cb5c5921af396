package com.bdi.pipeline.aggregate;

import com.bdi.pipeline.model.EntityState;
import java.util.Optional;

/** Read side of the pipeline as seen by callers. */
public interface QuerySink {

  AggregateResult aggregate(AggregateKind kind, TimeWindow window, AggregateParams params);

  Optional<EntityState> getLatest(String entityId);
}
