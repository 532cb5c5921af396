package com.bdi.api.archive;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Keeps downloaded snapshot files as-is, partitioned by day.
 *
 * <p>Implementations report write failures as
 * {@link com.bdi.pipeline.error.TransientInfraException} so the fetch that produced the file is
 * retried.
 */
public interface RawArchive {
  DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

  /** Called before the first file of a day is stored by a fresh ingestion. */
  void prepare(LocalDate day);

  void store(LocalDate day, String fileName, byte[] content);

  /** Partition name of a day, {@code day=YYYYMMDD}. */
  static String partition(LocalDate day) {
    return "day=" + DAY_FORMAT.format(day);
  }

  static RawArchive none() {
    return NoRawArchive.INSTANCE;
  }
}
