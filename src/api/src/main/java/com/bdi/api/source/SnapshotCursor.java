package com.bdi.api.source;

/**
 * Position inside a day of snapshot files: the file slot and the first aircraft entry to read.
 * Serialized as {@code <file>:<entry>}.
 */
record SnapshotCursor(int file, int entry) {

  static final SnapshotCursor START = new SnapshotCursor(0, 0);

  SnapshotCursor {
    if (file < 0 || entry < 0) {
      throw new IllegalArgumentException("cursor positions must be >= 0");
    }
  }

  static SnapshotCursor parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("cursor is required");
    }
    int separator = raw.indexOf(':');
    if (separator <= 0 || separator == raw.length() - 1) {
      throw new IllegalArgumentException("cursor must be <file>:<entry>, got " + raw);
    }
    try {
      return new SnapshotCursor(
          Integer.parseInt(raw.substring(0, separator)),
          Integer.parseInt(raw.substring(separator + 1)));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("cursor must be <file>:<entry>, got " + raw, ex);
    }
  }

  SnapshotCursor nextFile() {
    return new SnapshotCursor(file + 1, 0);
  }

  boolean isStart() {
    return file == 0 && entry == 0;
  }

  @Override
  public String toString() {
    return file + ":" + entry;
  }
}
