package com.bdi.api.source;

import com.bdi.api.archive.RawArchive;
import com.bdi.pipeline.ingest.FetchResult;
import com.bdi.pipeline.ingest.RawRecordSource;
import com.bdi.pipeline.model.RawBatch;
import com.bdi.pipeline.model.RawRecord;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raw record source over one day of {@code readsb-hist} snapshot files.
 *
 * <p>Each aircraft entry of a file becomes one raw record carrying the file's {@code now}
 * timestamp. A file with more entries than the batch size spans several batches, so the cursor
 * is {@code <file slot>:<first entry>}. A missing or unreadable file yields an empty batch and
 * the cursor moves to the next slot.
 *
 * <p>Batch ids ({@code YYYYMMDD-<file>-<entry>}) and sequences are derived from the cursor
 * alone, so a batch re-fetched after a restart carries the same ids as the first time.
 */
public abstract class SnapshotFileSource implements RawRecordSource {
  private static final Logger log = LoggerFactory.getLogger(SnapshotFileSource.class);
  private static final long ENTRIES_PER_FILE = 1_000_000L;

  private final ReadsbSnapshotParser parser;
  private final RawArchive archive;
  private final LocalDate day;
  private final int batchSize;
  private final Clock clock;
  private volatile LoadedFile lastFile;

  protected SnapshotFileSource(
      ReadsbSnapshotParser parser, RawArchive archive, LocalDate day, int batchSize, Clock clock) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
    }
    this.parser = parser;
    this.archive = archive;
    this.day = day;
    this.batchSize = batchSize;
    this.clock = clock;
  }

  /** Number of file slots the source reads before reporting end-of-stream. */
  protected abstract int fileCount();

  protected abstract String fileName(int slot);

  /**
   * Reads the raw content of one file slot.
   *
   * @return the file bytes, or empty when the slot has no file
   * @throws com.bdi.pipeline.error.TransientInfraException on a retryable read failure
   */
  protected abstract Optional<byte[]> read(int slot);

  /** Whether downloaded files are handed to the raw archive. */
  protected boolean archives() {
    return true;
  }

  public LocalDate day() {
    return day;
  }

  @Override
  public String initialCursor() {
    return SnapshotCursor.START.toString();
  }

  @Override
  public FetchResult fetchBatch(String cursor) {
    SnapshotCursor position = SnapshotCursor.parse(cursor);
    if (position.file() >= fileCount()) {
      return FetchResult.endOfStream();
    }
    if (position.isStart() && archives()) {
      archive.prepare(day);
    }

    Instant fetchedAt = clock.instant();
    ReadsbSnapshot snapshot = load(position.file());
    String name = fileName(position.file());
    String batchId = RawArchive.DAY_FORMAT.format(day) + "-" + baseName(name) + "-" + position.entry();
    long sequence = position.file() * ENTRIES_PER_FILE + position.entry();

    int from = Math.min(position.entry(), snapshot.size());
    int to = Math.min(from + batchSize, snapshot.size());
    List<RawRecord> records = new ArrayList<>(to - from);
    for (int i = from; i < to; i++) {
      records.add(new RawRecord(batchId, sequence, i - from, fetchedAt, withTimestamp(snapshot, i)));
    }

    SnapshotCursor next = to < snapshot.size()
        ? new SnapshotCursor(position.file(), to)
        : position.nextFile();
    return FetchResult.of(new RawBatch(batchId, cursor, sequence, fetchedAt, records), next.toString());
  }

  private ReadsbSnapshot load(int slot) {
    LoadedFile cached = lastFile;
    if (cached != null && cached.slot() == slot) {
      return cached.snapshot();
    }

    String name = fileName(slot);
    ReadsbSnapshot snapshot;
    Optional<byte[]> content = read(slot);
    if (content.isEmpty()) {
      log.debug("No snapshot file {} for {}", name, day);
      snapshot = ReadsbSnapshot.empty();
    } else {
      if (archives()) {
        archive.store(day, name, content.get());
      }
      snapshot = parse(name, content.get());
    }
    lastFile = new LoadedFile(slot, snapshot);
    return snapshot;
  }

  private ReadsbSnapshot parse(String name, byte[] content) {
    try {
      return parser.parse(content);
    } catch (IOException ex) {
      log.warn("Skipping unreadable snapshot file {}: {}", name, ex.getMessage());
      return ReadsbSnapshot.empty();
    }
  }

  private static String baseName(String fileName) {
    int dot = fileName.indexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  private static ObjectNode withTimestamp(ReadsbSnapshot snapshot, int index) {
    ObjectNode entry = snapshot.aircraft().get(index).deepCopy();
    if (snapshot.now() != null && !entry.has("now")) {
      entry.put("now", snapshot.now());
    }
    return entry;
  }

  private record LoadedFile(int slot, ReadsbSnapshot snapshot) {}
}
