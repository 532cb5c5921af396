package com.bdi.api.source;

import com.bdi.api.archive.RawArchive;
import com.bdi.pipeline.error.TransientInfraException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads one day of ADS-B Exchange {@code readsb-hist} snapshots over HTTP.
 *
 * <p>The archive publishes a file every five seconds, named {@code HHmmssZ.json.gz}, under
 * {@code <base>/YYYY/MM/DD/}. Slots are read in time order up to the configured file limit. A
 * 404 is an empty slot; 429, 5xx and I/O errors are transient and retried by the coordinator.
 */
public class ReadsbHistClient extends SnapshotFileSource {
  private static final Logger log = LoggerFactory.getLogger(ReadsbHistClient.class);
  private static final int SLOT_SECONDS = 5;
  private static final int SLOTS_PER_DAY = 86_400 / SLOT_SECONDS;
  private static final DateTimeFormatter DAY_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd");

  private final HttpClient httpClient;
  private final String baseUrl;
  private final int fileLimit;
  private final Duration requestTimeout;
  private final String userAgent;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter notFoundCounter;
  private final Counter rateLimitedCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter exceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public ReadsbHistClient(
      HttpClient httpClient,
      ReadsbSnapshotParser parser,
      RawArchive archive,
      MeterRegistry meterRegistry,
      String baseUrl,
      LocalDate day,
      int fileLimit,
      int batchSize,
      Duration requestTimeout,
      String userAgent,
      Clock clock) {
    super(parser, archive, day, batchSize, clock);
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("readsb-hist base URL is missing");
    }
    this.httpClient = httpClient;
    this.baseUrl = baseUrl.replaceAll("/+$", "");
    this.fileLimit = Math.max(0, Math.min(fileLimit, SLOTS_PER_DAY));
    this.requestTimeout = requestTimeout;
    this.userAgent = userAgent;

    this.requestTimer = Timer.builder("api.source.http.duration")
        .description("readsb-hist file download duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);
    this.successCounter = requests(meterRegistry, "success");
    this.notFoundCounter = requests(meterRegistry, "not_found");
    this.rateLimitedCounter = requests(meterRegistry, "rate_limited");
    this.clientErrorCounter = requests(meterRegistry, "client_error");
    this.serverErrorCounter = requests(meterRegistry, "server_error");
    this.exceptionCounter = requests(meterRegistry, "exception");
    meterRegistry.gauge("api.source.http.last_status", lastStatusCode);
  }

  private static Counter requests(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("api.source.http.requests")
        .description("readsb-hist HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  @Override
  public String sourceId() {
    return "readsb-hist:" + DateTimeFormatter.BASIC_ISO_DATE.format(day());
  }

  @Override
  protected int fileCount() {
    return fileLimit;
  }

  @Override
  protected String fileName(int slot) {
    int seconds = slot * SLOT_SECONDS;
    return String.format("%02d%02d%02dZ.json.gz", seconds / 3600, (seconds / 60) % 60, seconds % 60);
  }

  /** Full URL of a file slot. */
  public String fileUrl(int slot) {
    return baseUrl + "/" + DAY_PATH.format(day()) + "/" + fileName(slot);
  }

  @Override
  protected Optional<byte[]> read(int slot) {
    String url = fileUrl(slot);
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(requestTimeout)
        .header("User-Agent", userAgent)
        .GET()
        .build();

    long httpStartNs = System.nanoTime();
    try {
      HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      int status = response.statusCode();
      lastStatusCode.set(status);
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);

      if (status == 200) {
        successCounter.increment();
        return Optional.of(response.body());
      }
      if (status == 404) {
        notFoundCounter.increment();
        return Optional.empty();
      }
      if (status == 429) {
        rateLimitedCounter.increment();
        throw new TransientInfraException("readsb-hist rate limit hit (429) for " + url);
      }
      if (status >= 500) {
        serverErrorCounter.increment();
        throw new TransientInfraException("readsb-hist server error " + status + " for " + url);
      }
      // Other statuses will not change on retry.
      clientErrorCounter.increment();
      log.warn("readsb-hist fetch failed: status={} url={}", status, url);
      return Optional.empty();
    } catch (IOException ex) {
      lastStatusCode.set(0);
      requestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      exceptionCounter.increment();
      throw new TransientInfraException("readsb-hist request failed for " + url, ex);
    } catch (InterruptedException ex) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      throw new TransientInfraException("readsb-hist request interrupted for " + url, ex);
    }
  }
}
