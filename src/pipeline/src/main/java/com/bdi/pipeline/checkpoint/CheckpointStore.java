package com.bdi.pipeline.checkpoint;

import java.util.Optional;

/** Versioned storage of per-source checkpoints. */
public interface CheckpointStore {

  Optional<Checkpoint> load(String sourceId);

  /**
   * Stores {@code next} if the current version of its source is still {@code expectedVersion}.
   *
   * @param next checkpoint to store, with version {@code expectedVersion + 1}
   * @param expectedVersion version read before the commit, 0 when none was stored
   * @return the stored checkpoint
   * @throws com.bdi.pipeline.error.StaleCheckpointException when another writer committed first
   * @throws com.bdi.pipeline.error.TransientInfraException when the backing store is unavailable
   */
  Checkpoint commit(Checkpoint next, long expectedVersion);
}
