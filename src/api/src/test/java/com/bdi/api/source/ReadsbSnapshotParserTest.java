package com.bdi.api.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ReadsbSnapshotParserTest {
  private final ReadsbSnapshotParser parser = new ReadsbSnapshotParser(new ObjectMapper());

  @Test
  void skipsNonObjectEntriesAndKeepsOrder() throws Exception {
    String json = """
        {"now": 1698796800.5, "aircraft": [{"hex": "aaaaaa"}, 42, null, {"hex": "bbbbbb"}]}
        """;

    ReadsbSnapshot snapshot = parser.parse(ReadsbHistClientTest.gzip(json));

    assertThat(snapshot.now()).isEqualTo(1698796800.5);
    assertThat(snapshot.aircraft()).extracting(node -> node.get("hex").asText())
        .containsExactly("aaaaaa", "bbbbbb");
  }

  @Test
  void missingNowAndAircraftGiveEmptySnapshot() throws Exception {
    ReadsbSnapshot snapshot = parser.parse("{}".getBytes(StandardCharsets.UTF_8));

    assertThat(snapshot.now()).isNull();
    assertThat(snapshot.aircraft()).isEmpty();
  }

  @Test
  void rejectsNonObjectRoot() {
    assertThatThrownBy(() -> parser.parse("[1,2]".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(IOException.class);
  }
}
