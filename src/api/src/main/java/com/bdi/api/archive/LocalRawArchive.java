package com.bdi.api.archive;

import com.bdi.pipeline.error.TransientInfraException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes snapshot files under {@code <root>/day=YYYYMMDD/}. Preparing a day removes the files a
 * previous download left there.
 */
public class LocalRawArchive implements RawArchive {
  private static final Logger log = LoggerFactory.getLogger(LocalRawArchive.class);

  private final Path root;

  public LocalRawArchive(Path root) {
    this.root = root;
  }

  @Override
  public void prepare(LocalDate day) {
    Path dir = directory(day);
    try {
      Files.createDirectories(dir);
      List<Path> stale;
      try (Stream<Path> files = Files.list(dir)) {
        stale = files.filter(Files::isRegularFile).toList();
      }
      for (Path file : stale) {
        Files.deleteIfExists(file);
      }
      log.info("Prepared raw archive {} ({} old files removed)", dir, stale.size());
    } catch (IOException ex) {
      throw new TransientInfraException("Unable to prepare raw archive " + dir, ex);
    }
  }

  @Override
  public void store(LocalDate day, String fileName, byte[] content) {
    Path dir = directory(day);
    try {
      Files.createDirectories(dir);
      Files.write(dir.resolve(fileName), content);
    } catch (IOException ex) {
      throw new TransientInfraException("Unable to archive " + fileName + " into " + dir, ex);
    }
  }

  public Path directory(LocalDate day) {
    return root.resolve(RawArchive.partition(day));
  }
}
