package com.bdi.pipeline.checkpoint;

import com.bdi.pipeline.error.StaleCheckpointException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryCheckpointStore implements CheckpointStore {
  private final ConcurrentMap<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

  @Override
  public Optional<Checkpoint> load(String sourceId) {
    return Optional.ofNullable(checkpoints.get(sourceId));
  }

  @Override
  public Checkpoint commit(Checkpoint next, long expectedVersion) {
    checkpoints.compute(next.sourceId(), (id, current) -> {
      long currentVersion = current == null ? 0L : current.version();
      if (currentVersion != expectedVersion) {
        throw new StaleCheckpointException(id, expectedVersion);
      }
      return next;
    });
    return next;
  }
}
