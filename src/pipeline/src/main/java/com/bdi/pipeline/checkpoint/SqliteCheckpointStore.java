package com.bdi.pipeline.checkpoint;

import com.bdi.pipeline.error.StaleCheckpointException;
import com.bdi.pipeline.error.TransientInfraException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite implementation of {@link CheckpointStore}.
 *
 * <p>One row per source. Commits are optimistic: an {@code UPDATE ... WHERE version = ?} that
 * touches no row means another writer moved the checkpoint first.
 */
public class SqliteCheckpointStore implements CheckpointStore, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteCheckpointStore.class);

  private static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS checkpoints ("
          + "source_id TEXT PRIMARY KEY, "
          + "cursor TEXT NOT NULL, "
          + "version INTEGER NOT NULL, "
          + "last_batch_id TEXT, "
          + "updated_at INTEGER NOT NULL)";
  private static final String SELECT =
      "SELECT source_id, cursor, version, last_batch_id, updated_at FROM checkpoints WHERE source_id = ?";
  private static final String INSERT =
      "INSERT OR IGNORE INTO checkpoints (source_id, cursor, version, last_batch_id, updated_at) "
          + "VALUES (?, ?, ?, ?, ?)";
  private static final String UPDATE =
      "UPDATE checkpoints SET cursor = ?, version = ?, last_batch_id = ?, updated_at = ? "
          + "WHERE source_id = ? AND version = ?";

  private final Connection connection;

  /**
   * Opens or creates the checkpoint database.
   *
   * @param sqlitePath database file; parent directories are created when missing
   */
  public SqliteCheckpointStore(Path sqlitePath) {
    try {
      Path parent = sqlitePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      this.connection = DriverManager.getConnection("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
      try (Statement statement = connection.createStatement()) {
        statement.execute(CREATE_TABLE);
      }
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to open checkpoint SQLite DB at " + sqlitePath, ex);
    }
    LOGGER.info("Checkpoint store opened at {}", sqlitePath.toAbsolutePath());
  }

  @Override
  public synchronized Optional<Checkpoint> load(String sourceId) {
    try (PreparedStatement select = connection.prepareStatement(SELECT)) {
      select.setString(1, sourceId);
      try (ResultSet rs = select.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new Checkpoint(
            rs.getString("source_id"),
            rs.getString("cursor"),
            rs.getLong("version"),
            rs.getString("last_batch_id"),
            Instant.ofEpochMilli(rs.getLong("updated_at"))));
      }
    } catch (SQLException ex) {
      throw new TransientInfraException("Failed to load checkpoint for " + sourceId, ex);
    }
  }

  @Override
  public synchronized Checkpoint commit(Checkpoint next, long expectedVersion) {
    try {
      int updated;
      if (expectedVersion == 0L) {
        try (PreparedStatement insert = connection.prepareStatement(INSERT)) {
          insert.setString(1, next.sourceId());
          insert.setString(2, next.cursor());
          insert.setLong(3, next.version());
          insert.setString(4, next.lastBatchId());
          insert.setLong(5, next.updatedAt().toEpochMilli());
          updated = insert.executeUpdate();
        }
      } else {
        try (PreparedStatement update = connection.prepareStatement(UPDATE)) {
          update.setString(1, next.cursor());
          update.setLong(2, next.version());
          update.setString(3, next.lastBatchId());
          update.setLong(4, next.updatedAt().toEpochMilli());
          update.setString(5, next.sourceId());
          update.setLong(6, expectedVersion);
          updated = update.executeUpdate();
        }
      }
      if (updated == 0) {
        throw new StaleCheckpointException(next.sourceId(), expectedVersion);
      }
      return next;
    } catch (SQLException ex) {
      throw new TransientInfraException("Failed to commit checkpoint for " + next.sourceId(), ex);
    }
  }

  @Override
  public synchronized void close() {
    try {
      connection.close();
    } catch (SQLException ex) {
      LOGGER.warn("Failed to close checkpoint SQLite DB", ex);
    }
  }
}
