package com.bdi.pipeline.normalize;

import com.bdi.pipeline.model.CanonicalRecord;
import java.util.List;

/**
 * Normalizer output for a whole batch.
 *
 * @param records accepted records in source order
 * @param rejections reason-coded rejections in source order
 */
public record NormalizedBatch(List<CanonicalRecord> records, List<Rejection> rejections) {
  public NormalizedBatch {
    records = List.copyOf(records);
    rejections = List.copyOf(rejections);
  }
}
