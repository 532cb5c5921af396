package com.bdi.pipeline.ingest;

import com.bdi.pipeline.model.CanonicalRecord;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Assigns every entity to exactly one store partition. */
public class EntityPartitioner {
  private final int partitions;

  public EntityPartitioner(int partitions) {
    if (partitions <= 0) {
      throw new IllegalArgumentException("partitions must be positive");
    }
    this.partitions = partitions;
  }

  public int partitions() {
    return partitions;
  }

  public int partitionOf(String entityId) {
    return Math.floorMod(entityId.hashCode(), partitions);
  }

  /** Groups records by partition, keeping their relative order inside each partition. */
  public Map<Integer, List<CanonicalRecord>> split(List<CanonicalRecord> records) {
    return records.stream().collect(Collectors.groupingBy(
        record -> partitionOf(record.entityId()),
        TreeMap::new,
        Collectors.toList()));
  }
}
