package com.bdi.api.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SnapshotCursorTest {

  @Test
  void parsesAndFormats() {
    SnapshotCursor cursor = SnapshotCursor.parse("12:500");

    assertThat(cursor.file()).isEqualTo(12);
    assertThat(cursor.entry()).isEqualTo(500);
    assertThat(cursor.toString()).isEqualTo("12:500");
    assertThat(cursor.nextFile()).hasToString("13:0");
    assertThat(SnapshotCursor.START.isStart()).isTrue();
  }

  @Test
  void rejectsMalformedCursors() {
    assertThatThrownBy(() -> SnapshotCursor.parse("12")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnapshotCursor.parse(":3")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnapshotCursor.parse("a:b")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnapshotCursor.parse("-1:0")).isInstanceOf(IllegalArgumentException.class);
  }
}
