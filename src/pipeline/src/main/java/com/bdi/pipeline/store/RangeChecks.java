package com.bdi.pipeline.store;

import com.bdi.pipeline.error.InvalidQueryException;
import java.time.Instant;
import java.util.Objects;

final class RangeChecks {
  private RangeChecks() {}

  static void requireRange(Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new InvalidQueryException("range start " + start + " is after end " + end);
    }
  }

  static void requirePage(int offset, int limit) {
    if (offset < 0 || limit < 0) {
      throw new InvalidQueryException("offset and limit must not be negative");
    }
  }
}
