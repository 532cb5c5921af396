package com.bdi.api.api;

import com.bdi.api.config.BdiProperties;
import com.bdi.api.model.AircraftPosition;
import com.bdi.api.model.AircraftStateResponse;
import com.bdi.api.model.AircraftStats;
import com.bdi.api.model.AircraftSummary;
import com.bdi.api.service.AircraftQueryService;
import com.bdi.api.service.QueryParser;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-aircraft read endpoints.
 *
 * <p>Aircraft are addressed by their ICAO 24-bit hex address, case-insensitively.
 */
@RestController
@RequestMapping("/api/v1/aircraft")
public class AircraftController {
  private final AircraftQueryService aircraftQueryService;
  private final BdiProperties properties;

  public AircraftController(AircraftQueryService aircraftQueryService, BdiProperties properties) {
    this.aircraftQueryService = aircraftQueryService;
    this.properties = properties;
  }

  /**
   * Lists known aircraft ordered by ICAO address ascending.
   *
   * @param numResults optional page size; non-positive values use the default
   * @param page optional zero-based page; negative values mean the first page
   * @return one page of aircraft
   */
  @GetMapping
  public List<AircraftSummary> listAircraft(
      @RequestParam(name = "num_results", required = false) String numResults,
      @RequestParam(name = "page", required = false) String page) {
    BdiProperties.Api api = properties.getApi();
    return aircraftQueryService.listAircraft(
        QueryParser.parsePageSize(numResults, api.getDefaultPageSize(), api.getMaxPageSize()),
        QueryParser.parsePage(page));
  }

  /**
   * Lists the known positions of one aircraft ordered by time ascending.
   *
   * @param icao aircraft address
   * @param numResults optional page size
   * @param page optional zero-based page
   * @return one page of positions, empty for an unknown aircraft
   */
  @GetMapping("/{icao}/positions")
  public List<AircraftPosition> positions(
      @PathVariable String icao,
      @RequestParam(name = "num_results", required = false) String numResults,
      @RequestParam(name = "page", required = false) String page) {
    BdiProperties.Api api = properties.getApi();
    return aircraftQueryService.positions(
        QueryParser.normalizeIcao(icao),
        QueryParser.parsePageSize(numResults, api.getDefaultPositionsPageSize(), api.getMaxPageSize()),
        QueryParser.parsePage(page));
  }

  @GetMapping("/{icao}/stats")
  public AircraftStats stats(@PathVariable String icao) {
    return aircraftQueryService.stats(QueryParser.normalizeIcao(icao));
  }

  /**
   * Returns the latest merged state of one aircraft.
   *
   * @param icao aircraft address
   * @return state payload
   */
  @GetMapping("/{icao}")
  public AircraftStateResponse latest(@PathVariable String icao) {
    String normalized = QueryParser.normalizeIcao(icao);
    return aircraftQueryService.latest(normalized)
        .map(AircraftStateResponse::from)
        .orElseThrow(() -> new NotFoundException("aircraft not found: " + normalized));
  }
}
