package com.bdi.api.source;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * One parsed {@code readsb-hist} file.
 *
 * @param now snapshot time in epoch seconds, {@code null} when the file carries none
 * @param aircraft aircraft entries in file order
 */
public record ReadsbSnapshot(Double now, List<ObjectNode> aircraft) {

  public ReadsbSnapshot {
    aircraft = List.copyOf(aircraft);
  }

  public static ReadsbSnapshot empty() {
    return new ReadsbSnapshot(null, List.of());
  }

  public int size() {
    return aircraft.size();
  }
}
