package com.bdi.api.api;

import com.bdi.api.config.BdiProperties;
import com.bdi.api.model.CountsResponse;
import com.bdi.api.model.SnapshotResponse;
import com.bdi.api.service.AggregateQueryService;
import com.bdi.api.service.QueryParser;
import com.bdi.pipeline.aggregate.TimeWindow;
import java.time.Clock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Windowed aggregate endpoints.
 *
 * <p>Windows are half-open {@code [from, to)}. {@code to} defaults to now and {@code from} to
 * {@code to} minus {@code window}. Bounds accept epoch seconds, epoch milliseconds or ISO-8601.
 * Results may be served from a cache and lag the store by the configured stale bound.
 */
@RestController
@RequestMapping("/api/v1/aggregates")
public class AggregateController {
  private final AggregateQueryService aggregateQueryService;
  private final BdiProperties properties;
  private final Clock clock;

  public AggregateController(
      AggregateQueryService aggregateQueryService, BdiProperties properties, Clock clock) {
    this.aggregateQueryService = aggregateQueryService;
    this.properties = properties;
    this.clock = clock;
  }

  @GetMapping("/counts")
  public CountsResponse counts(
      @RequestParam(name = "from", required = false) String from,
      @RequestParam(name = "to", required = false) String to,
      @RequestParam(name = "window", required = false) String window,
      @RequestParam(name = "icao", required = false) String icao) {
    return aggregateQueryService.counts(window(from, to, window), QueryParser.parseIcaoList(icao));
  }

  /**
   * Returns the busiest aircraft of the window.
   *
   * @param k number of aircraft to return; must be positive
   * @return counts ordered by count descending, then ICAO address ascending
   */
  @GetMapping("/top")
  public CountsResponse top(
      @RequestParam(name = "k", required = false) String k,
      @RequestParam(name = "from", required = false) String from,
      @RequestParam(name = "to", required = false) String to,
      @RequestParam(name = "window", required = false) String window,
      @RequestParam(name = "icao", required = false) String icao) {
    BdiProperties.Api api = properties.getApi();
    return aggregateQueryService.topK(
        window(from, to, window),
        QueryParser.parseTopK(k, api.getDefaultTopK(), api.getMaxTopK()),
        QueryParser.parseIcaoList(icao));
  }

  @GetMapping("/snapshot")
  public SnapshotResponse snapshot(
      @RequestParam(name = "from", required = false) String from,
      @RequestParam(name = "to", required = false) String to,
      @RequestParam(name = "window", required = false) String window,
      @RequestParam(name = "icao", required = false) String icao) {
    return aggregateQueryService.snapshot(window(from, to, window), QueryParser.parseIcaoList(icao));
  }

  private TimeWindow window(String from, String to, String window) {
    BdiProperties.Api api = properties.getApi();
    return QueryParser.resolveWindow(
        from, to, window, clock.instant(), api.getDefaultWindow(), api.getMaxWindow());
  }
}
