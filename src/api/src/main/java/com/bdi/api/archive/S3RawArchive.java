package com.bdi.api.archive;

import com.bdi.pipeline.error.TransientInfraException;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Uploads snapshot files to {@code s3://<bucket>/<prefix>/day=YYYYMMDD/<file>}.
 *
 * <p>Objects are overwritten on re-download, so nothing is cleaned when a day is prepared.
 */
public class S3RawArchive implements RawArchive {
  private static final Logger log = LoggerFactory.getLogger(S3RawArchive.class);

  private final S3Client s3Client;
  private final String bucket;
  private final String prefix;

  public S3RawArchive(S3Client s3Client, String bucket, String prefix) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("S3 bucket is required for the s3 raw archive");
    }
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix.replaceAll("/+$", "");
  }

  @Override
  public void prepare(LocalDate day) {
    log.info("Archiving raw files to s3://{}/{}", bucket, key(day, ""));
  }

  @Override
  public void store(LocalDate day, String fileName, byte[] content) {
    String key = key(day, fileName);
    PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(fileName.endsWith(".gz") ? "application/gzip" : "application/json")
        .build();
    try {
      s3Client.putObject(request, RequestBody.fromBytes(content));
    } catch (SdkException ex) {
      throw new TransientInfraException("Unable to upload s3://" + bucket + "/" + key, ex);
    }
  }

  String key(LocalDate day, String fileName) {
    String partition = RawArchive.partition(day) + "/" + fileName;
    return prefix.isEmpty() ? partition : prefix + "/" + partition;
  }
}
