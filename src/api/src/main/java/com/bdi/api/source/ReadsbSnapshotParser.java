package com.bdi.api.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.springframework.stereotype.Component;

/**
 * Parses {@code readsb-hist} snapshot files.
 *
 * <p>Files are normally gzip-compressed JSON, but the archive sometimes serves them already
 * decompressed, so content without the gzip magic is read as plain JSON.
 */
@Component
public class ReadsbSnapshotParser {
  private final ObjectMapper objectMapper;

  public ReadsbSnapshotParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses one file.
   *
   * @param content raw file bytes
   * @return the snapshot time and its aircraft entries; non-object entries are skipped
   * @throws IOException when the content is neither gzip JSON nor plain JSON
   */
  public ReadsbSnapshot parse(byte[] content) throws IOException {
    JsonNode root;
    try (InputStream in = open(content)) {
      root = objectMapper.readTree(in);
    }
    if (root == null || !root.isObject()) {
      throw new IOException("snapshot root is not a JSON object");
    }

    JsonNode now = root.get("now");
    Double snapshotTime = now != null && now.isNumber() ? now.asDouble() : null;
    List<ObjectNode> aircraft = new ArrayList<>();
    JsonNode entries = root.path("aircraft");
    if (entries.isArray()) {
      for (JsonNode entry : entries) {
        if (entry instanceof ObjectNode object) {
          aircraft.add(object);
        }
      }
    }
    return new ReadsbSnapshot(snapshotTime, aircraft);
  }

  private static InputStream open(byte[] content) throws IOException {
    InputStream raw = new ByteArrayInputStream(content);
    if (content.length >= 2 && (content[0] & 0xff) == 0x1f && (content[1] & 0xff) == 0x8b) {
      return new GZIPInputStream(raw);
    }
    return raw;
  }
}
