package com.bdi.pipeline.ingest;

import java.time.Duration;

/**
 * Exponential backoff bounded by a total number of attempts.
 *
 * @param maxAttempts total attempts, first attempt included
 * @param initialBackoff delay after the first failed attempt
 * @param maxBackoff upper bound of any delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

  /**
   * Delay to wait after the given failed attempt.
   *
   * @param failedAttempt 1-based number of the attempt that just failed
   */
  public Duration backoff(int failedAttempt) {
    int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
    long millis = initialBackoff.toMillis() << shift;
    if (millis < 0 || millis > maxBackoff.toMillis()) {
      return maxBackoff;
    }
    return Duration.ofMillis(millis);
  }

  public boolean canRetry(int failedAttempt) {
    return failedAttempt < maxAttempts;
  }
}
