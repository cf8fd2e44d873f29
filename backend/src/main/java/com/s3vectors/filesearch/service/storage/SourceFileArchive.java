package com.s3vectors.filesearch.service.storage;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.s3vectors.filesearch.config.VectorServiceProperties;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Keeps a copy of each uploaded source file in regular S3 under {@code files/<key>/<name>}.
 * Disabled unless an {@link S3Client} bean exists. Every operation is best effort: failures are
 * logged and never abort the vector operation that triggered them.
 */
@Slf4j
@Service
public class SourceFileArchive {

  private static final String FILE_PREFIX = "files/";

  private final S3Client s3Client;
  private final String bucketName;

  @Autowired
  public SourceFileArchive(
      ObjectProvider<S3Client> s3ClientProvider, VectorServiceProperties properties) {
    this(s3ClientProvider.getIfAvailable(), resolveBucket(properties));
  }

  public SourceFileArchive(S3Client s3Client, String bucketName) {
    this.s3Client = s3Client;
    this.bucketName = bucketName;
    if (s3Client != null) {
      log.info("Source files will be archived to s3://{}/{}", bucketName, FILE_PREFIX);
    }
  }

  public boolean isEnabled() {
    return s3Client != null && bucketName != null && !bucketName.isBlank();
  }

  public static String objectKey(String vectorKey, String fileName) {
    return FILE_PREFIX + vectorKey + "/" + fileName;
  }

  /** Upload the file with the vector metadata attached as object metadata. */
  public boolean archive(
      String vectorKey, Path file, String contentType, Map<String, String> metadata) {
    if (!isEnabled()) {
      return false;
    }

    String key = objectKey(vectorKey, file.getFileName().toString());
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucketName)
              .key(key)
              .contentType(contentType)
              .metadata(sanitizeMetadata(metadata))
              .build(),
          RequestBody.fromFile(file));
      log.info("Archived source file {} at key: {}", file.getFileName(), key);
      return true;
    } catch (Exception e) {
      log.warn("Could not archive source file {}: {}", file.getFileName(), e.getMessage());
      return false;
    }
  }

  public boolean remove(String vectorKey, String fileName) {
    if (!isEnabled() || fileName == null) {
      return false;
    }

    String key = objectKey(vectorKey, fileName);
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
      log.info("Deleted archived source file {}", key);
      return true;
    } catch (Exception e) {
      log.warn("Could not delete archived source file {}: {}", key, e.getMessage());
      return false;
    }
  }

  private static Map<String, String> sanitizeMetadata(Map<String, String> metadata) {
    Map<String, String> sanitized = new LinkedHashMap<>();
    metadata.forEach(
        (key, value) -> {
          if (value != null) {
            sanitized.put(key.replaceAll("[^A-Za-z0-9_-]", "_"), value);
          }
        });
    return sanitized;
  }

  private static String resolveBucket(VectorServiceProperties properties) {
    String archiveBucket = properties.getBackend().getArchiveBucketName();
    return archiveBucket != null && !archiveBucket.isBlank()
        ? archiveBucket
        : properties.getAws().getVectorBucketName();
  }
}
