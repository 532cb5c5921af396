package com.bdi.pipeline.ingest;

import java.time.Duration;

/** Backoff delay between retry attempts. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
