package com.bdi.api.config;

import com.bdi.pipeline.ingest.PipelineConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the telemetry service.
 *
 * <p>Values are bound from {@code bdi.*} in {@code application.yml} and environment variables.
 */
@ConfigurationProperties(prefix = "bdi")
public class BdiProperties {
  private final Source source = new Source();
  private final Archive archive = new Archive();
  private final Store store = new Store();
  private final Checkpoint checkpoint = new Checkpoint();
  private final Ingest ingest = new Ingest();
  private final Retention retention = new Retention();
  private final Api api = new Api();

  public Source getSource() {
    return source;
  }

  public Archive getArchive() {
    return archive;
  }

  public Store getStore() {
    return store;
  }

  public Checkpoint getCheckpoint() {
    return checkpoint;
  }

  public Ingest getIngest() {
    return ingest;
  }

  public Retention getRetention() {
    return retention;
  }

  public Api getApi() {
    return api;
  }

  /** Where raw snapshots come from: the readsb-hist HTTP archive or a local directory. */
  public static class Source {
    private String type = "http";
    private String baseUrl = "https://samples.adsbexchange.com/readsb-hist";
    private String day = "2023-11-01";
    private String localDir = "data/raw/day=20231101";
    private int fileLimit = 100;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private String userAgent = "bdi-api/0.1";

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getDay() {
      return day;
    }

    public void setDay(String day) {
      this.day = day;
    }

    public String getLocalDir() {
      return localDir;
    }

    public void setLocalDir(String localDir) {
      this.localDir = localDir;
    }

    public int getFileLimit() {
      return fileLimit;
    }

    public void setFileLimit(int fileLimit) {
      this.fileLimit = fileLimit;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(String userAgent) {
      this.userAgent = userAgent;
    }
  }

  /** Raw file archival of downloaded snapshots ({@code none}, {@code local} or {@code s3}). */
  public static class Archive {
    private String type = "none";
    private String dir = "data/raw";
    private String bucket;
    private String prefix = "raw";

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getDir() {
      return dir;
    }

    public void setDir(String dir) {
      this.dir = dir;
    }

    public String getBucket() {
      return bucket;
    }

    public void setBucket(String bucket) {
      this.bucket = bucket;
    }

    public String getPrefix() {
      return prefix;
    }

    public void setPrefix(String prefix) {
      this.prefix = prefix;
    }
  }

  /** Record store backend ({@code memory} or {@code redis}). */
  public static class Store {
    private String backend = "memory";
    private String keyPrefix = "bdi";

    public String getBackend() {
      return backend;
    }

    public void setBackend(String backend) {
      this.backend = backend;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }
  }

  /** Checkpoint store backend ({@code sqlite} or {@code memory}). */
  public static class Checkpoint {
    private String backend = "sqlite";
    private String path = "data/checkpoints.db";

    public String getBackend() {
      return backend;
    }

    public void setBackend(String backend) {
      this.backend = backend;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }
  }

  /** Pipeline tuning and the scheduled ingestion run. */
  public static class Ingest {
    private int batchSize = 1000;
    private int retryLimit = 3;
    private Duration staleBound = Duration.ofSeconds(5);
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private Duration storeTimeout = Duration.ofSeconds(10);
    private Duration initialBackoff = Duration.ofMillis(200);
    private Duration maxBackoff = Duration.ofSeconds(5);
    private int partitions = 4;
    private int maxInFlightBatches = 4;
    private int workerThreads = 2;
    private int cacheSize = 256;
    private int maxBatchesPerRun = 100;
    private long intervalMs = 60_000L;

    /** Builds the validated pipeline configuration from the bound values. */
    public PipelineConfig toPipelineConfig() {
      return new PipelineConfig(
          batchSize,
          retryLimit,
          staleBound,
          fetchTimeout,
          storeTimeout,
          initialBackoff,
          maxBackoff,
          partitions,
          maxInFlightBatches,
          workerThreads);
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getRetryLimit() {
      return retryLimit;
    }

    public void setRetryLimit(int retryLimit) {
      this.retryLimit = retryLimit;
    }

    public Duration getStaleBound() {
      return staleBound;
    }

    public void setStaleBound(Duration staleBound) {
      this.staleBound = staleBound;
    }

    public Duration getFetchTimeout() {
      return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = fetchTimeout;
    }

    public Duration getStoreTimeout() {
      return storeTimeout;
    }

    public void setStoreTimeout(Duration storeTimeout) {
      this.storeTimeout = storeTimeout;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public int getMaxInFlightBatches() {
      return maxInFlightBatches;
    }

    public void setMaxInFlightBatches(int maxInFlightBatches) {
      this.maxInFlightBatches = maxInFlightBatches;
    }

    public int getWorkerThreads() {
      return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
    }

    public int getCacheSize() {
      return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
      this.cacheSize = cacheSize;
    }

    public int getMaxBatchesPerRun() {
      return maxBatchesPerRun;
    }

    public void setMaxBatchesPerRun(int maxBatchesPerRun) {
      this.maxBatchesPerRun = maxBatchesPerRun;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }
  }

  /** Scheduled purge of old records and entity states. */
  public static class Retention {
    private boolean enabled = false;
    private Duration maxAge = Duration.ofDays(7);
    private long intervalMs = 3_600_000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getMaxAge() {
      return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
      this.maxAge = maxAge;
    }

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }
  }

  /** API-level limits (page sizes, windows, top-K bounds). */
  public static class Api {
    private int defaultPageSize = 100;
    private int defaultPositionsPageSize = 1000;
    private int maxPageSize = 10_000;
    private Duration defaultWindow = Duration.ofHours(1);
    private Duration maxWindow = Duration.ofDays(7);
    private int defaultTopK = 10;
    private int maxTopK = 1000;
    private int maxBatchesPerRequest = 1000;

    public int getDefaultPageSize() {
      return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
      this.defaultPageSize = defaultPageSize;
    }

    public int getDefaultPositionsPageSize() {
      return defaultPositionsPageSize;
    }

    public void setDefaultPositionsPageSize(int defaultPositionsPageSize) {
      this.defaultPositionsPageSize = defaultPositionsPageSize;
    }

    public int getMaxPageSize() {
      return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
      this.maxPageSize = maxPageSize;
    }

    public Duration getDefaultWindow() {
      return defaultWindow;
    }

    public void setDefaultWindow(Duration defaultWindow) {
      this.defaultWindow = defaultWindow;
    }

    public Duration getMaxWindow() {
      return maxWindow;
    }

    public void setMaxWindow(Duration maxWindow) {
      this.maxWindow = maxWindow;
    }

    public int getDefaultTopK() {
      return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
      this.defaultTopK = defaultTopK;
    }

    public int getMaxTopK() {
      return maxTopK;
    }

    public void setMaxTopK(int maxTopK) {
      this.maxTopK = maxTopK;
    }

    public int getMaxBatchesPerRequest() {
      return maxBatchesPerRequest;
    }

    public void setMaxBatchesPerRequest(int maxBatchesPerRequest) {
      this.maxBatchesPerRequest = maxBatchesPerRequest;
    }
  }
}
