package com.bdi.api.config;

import com.bdi.api.archive.LocalRawArchive;
import com.bdi.api.archive.RawArchive;
import com.bdi.api.archive.S3RawArchive;
import com.bdi.api.source.LocalReadsbSource;
import com.bdi.api.source.ReadsbHistClient;
import com.bdi.api.source.ReadsbSnapshotParser;
import com.bdi.pipeline.aggregate.AggregationEngine;
import com.bdi.pipeline.checkpoint.CheckpointStore;
import com.bdi.pipeline.checkpoint.InMemoryCheckpointStore;
import com.bdi.pipeline.checkpoint.SqliteCheckpointStore;
import com.bdi.pipeline.ingest.IngestionCoordinator;
import com.bdi.pipeline.ingest.PipelineConfig;
import com.bdi.pipeline.ingest.RawRecordSource;
import com.bdi.pipeline.merge.MergeEngine;
import com.bdi.pipeline.normalize.RecordNormalizer;
import com.bdi.pipeline.normalize.RecordSchema;
import com.bdi.pipeline.store.InMemoryRecordStore;
import com.bdi.pipeline.store.RecordStore;
import com.bdi.pipeline.store.RedisRecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Wires the ingestion pipeline from {@link BdiProperties}.
 *
 * <p>Backends are picked by name: {@code bdi.store.backend}, {@code bdi.checkpoint.backend},
 * {@code bdi.source.type} and {@code bdi.archive.type}. An unknown name fails startup.
 */
@Configuration
public class PipelineConfiguration {
  private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

  @Bean
  public PipelineConfig pipelineConfig(BdiProperties properties) {
    return properties.getIngest().toPipelineConfig();
  }

  @Bean
  public MergeEngine mergeEngine() {
    return new MergeEngine();
  }

  @Bean
  public RecordNormalizer recordNormalizer(MeterRegistry meterRegistry) {
    return new RecordNormalizer(RecordSchema.readsb(), meterRegistry);
  }

  @Bean
  public RecordStore recordStore(
      BdiProperties properties,
      MergeEngine mergeEngine,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      ObjectMapper objectMapper) {
    BdiProperties.Store store = properties.getStore();
    String backend = store.getBackend().toLowerCase(Locale.ROOT);
    log.info("Record store backend: {}", backend);
    return switch (backend) {
      case "memory" -> new InMemoryRecordStore(mergeEngine);
      case "redis" -> new RedisRecordStore(
          redisTemplate.getObject(), objectMapper, mergeEngine, store.getKeyPrefix());
      default -> throw new IllegalStateException("Unknown bdi.store.backend: " + store.getBackend());
    };
  }

  @Bean
  public CheckpointStore checkpointStore(BdiProperties properties) {
    BdiProperties.Checkpoint checkpoint = properties.getCheckpoint();
    String backend = checkpoint.getBackend().toLowerCase(Locale.ROOT);
    log.info("Checkpoint store backend: {}", backend);
    return switch (backend) {
      case "sqlite" -> new SqliteCheckpointStore(Path.of(checkpoint.getPath()));
      case "memory" -> new InMemoryCheckpointStore();
      default -> throw new IllegalStateException(
          "Unknown bdi.checkpoint.backend: " + checkpoint.getBackend());
    };
  }

  @Bean
  public RawArchive rawArchive(BdiProperties properties, ObjectProvider<S3Client> s3Client) {
    BdiProperties.Archive archive = properties.getArchive();
    return switch (archive.getType().toLowerCase(Locale.ROOT)) {
      case "none" -> RawArchive.none();
      case "local" -> new LocalRawArchive(Path.of(archive.getDir()));
      case "s3" -> new S3RawArchive(s3Client.getObject(), archive.getBucket(), archive.getPrefix());
      default -> throw new IllegalStateException("Unknown bdi.archive.type: " + archive.getType());
    };
  }

  @Bean
  public RawRecordSource rawRecordSource(
      BdiProperties properties,
      HttpClient httpClient,
      ReadsbSnapshotParser parser,
      RawArchive rawArchive,
      MeterRegistry meterRegistry,
      Clock clock) {
    BdiProperties.Source source = properties.getSource();
    LocalDate day = LocalDate.parse(source.getDay());
    int batchSize = properties.getIngest().getBatchSize();
    return switch (source.getType().toLowerCase(Locale.ROOT)) {
      case "http" -> new ReadsbHistClient(
          httpClient,
          parser,
          rawArchive,
          meterRegistry,
          source.getBaseUrl(),
          day,
          source.getFileLimit(),
          batchSize,
          source.getRequestTimeout(),
          source.getUserAgent(),
          clock);
      case "local" -> new LocalReadsbSource(
          Path.of(source.getLocalDir()), parser, day, source.getFileLimit(), batchSize, clock);
      default -> throw new IllegalStateException("Unknown bdi.source.type: " + source.getType());
    };
  }

  @Bean
  public IngestionCoordinator ingestionCoordinator(
      RawRecordSource source,
      RecordNormalizer normalizer,
      MergeEngine mergeEngine,
      RecordStore recordStore,
      CheckpointStore checkpointStore,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    return new IngestionCoordinator(
        source, normalizer, mergeEngine, recordStore, checkpointStore, pipelineConfig, meterRegistry);
  }

  @Bean
  public AggregationEngine aggregationEngine(
      RecordStore recordStore,
      MergeEngine mergeEngine,
      PipelineConfig pipelineConfig,
      BdiProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new AggregationEngine(
        recordStore,
        mergeEngine,
        pipelineConfig.staleBound(),
        properties.getIngest().getCacheSize(),
        clock,
        meterRegistry);
  }
}
