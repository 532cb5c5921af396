package com.bdi.pipeline.aggregate;

import com.bdi.pipeline.error.InvalidQueryException;
import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time window {@code [start, end)}.
 *
 * @param start inclusive lower bound
 * @param end exclusive upper bound, strictly after {@code start}
 */
public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    if (start == null || end == null) {
      throw new InvalidQueryException("window bounds are required");
    }
    if (!start.isBefore(end)) {
      throw new InvalidQueryException("window start " + start + " must be before end " + end);
    }
  }

  public static TimeWindow of(Instant start, Instant end) {
    return new TimeWindow(start, end);
  }

  public static TimeWindow ending(Instant end, Duration length) {
    return new TimeWindow(end.minus(length), end);
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
