package com.bdi.api.source;

import com.bdi.api.archive.RawArchive;
import com.bdi.pipeline.error.TransientInfraException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads snapshot files from a local directory, typically one filled by a previous download.
 *
 * <p>Files ending in {@code .json.gz} or {@code .json} are read in name order, which is time
 * order for {@code readsb-hist} names. The listing is taken on every fetch, so slots stay stable
 * only while the directory is not modified.
 */
public class LocalReadsbSource extends SnapshotFileSource {
  private final Path directory;
  private final int fileLimit;

  public LocalReadsbSource(
      Path directory,
      ReadsbSnapshotParser parser,
      LocalDate day,
      int fileLimit,
      int batchSize,
      Clock clock) {
    super(parser, RawArchive.none(), day, batchSize, clock);
    this.directory = directory;
    this.fileLimit = Math.max(0, fileLimit);
  }

  @Override
  public String sourceId() {
    return "local:" + directory.toAbsolutePath().normalize();
  }

  @Override
  protected boolean archives() {
    return false;
  }

  @Override
  protected int fileCount() {
    return Math.min(fileLimit, files().size());
  }

  @Override
  protected String fileName(int slot) {
    List<Path> files = files();
    return slot < files.size() ? files.get(slot).getFileName().toString() : "missing-" + slot;
  }

  @Override
  protected Optional<byte[]> read(int slot) {
    List<Path> files = files();
    if (slot >= files.size()) {
      return Optional.empty();
    }
    Path file = files.get(slot);
    try {
      return Optional.of(Files.readAllBytes(file));
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    } catch (IOException ex) {
      throw new TransientInfraException("Unable to read snapshot file " + file, ex);
    }
  }

  List<Path> files() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(path -> {
            String name = path.getFileName().toString();
            return name.endsWith(".json.gz") || name.endsWith(".json");
          })
          .sorted()
          .toList();
    } catch (IOException ex) {
      throw new TransientInfraException("Unable to list snapshot directory " + directory, ex);
    }
  }
}
