package com.s3vectors.filesearch.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.s3vectors.filesearch.service.embedding.TextTruncationStrategy;

import lombok.Data;

/**
 * Configuration for the vector file search service. Bound once at start-up and handed to each
 * component through its constructor.
 */
@Data
@Component
@ConfigurationProperties(prefix = "vector-service")
public class VectorServiceProperties {

  private Aws aws = new Aws();
  private Backend backend = new Backend();
  private Embedding embedding = new Embedding();
  private Vector vector = new Vector();
  private Validation validation = new Validation();
  private Performance performance = new Performance();

  @Data
  public static class Aws {
    private String region = "us-east-1";
    /** Region of the vector bucket, falls back to {@link #region} when blank. */
    private String bucketRegion;

    private String profile;
    private String accessKeyId;
    private String secretAccessKey;
    private String vectorBucketName;
    private String vectorIndexName = "default-index";

    public String effectiveBucketRegion() {
      return bucketRegion == null || bucketRegion.isBlank() ? region : bucketRegion;
    }
  }

  @Data
  public static class Backend {
    private BackendType type = BackendType.S3VECTORS;
    private boolean deleteSupported = true;
    private boolean archiveSourceFiles = false;
    /** Bucket for archived source files, defaults to the vector bucket name. */
    private String archiveBucketName;
  }

  public enum BackendType {
    S3VECTORS,
    MEMORY
  }

  @Data
  public static class Embedding {
    private String modelId = "amazon.titan-embed-text-v2:0";
    private boolean normalize = true;
  }

  @Data
  public static class Vector {
    private int dimension = 1024;
    private int maxTextLength = 512;
    private TextTruncationStrategy truncationStrategy = TextTruncationStrategy.END;

    private int imageResizeWidth = 224;
    private int imageResizeHeight = 224;
    private String imageFormat = "JPEG";

    private int defaultTopK = 10;
    private int maxTopK = 30;
    private double defaultSimilarityThreshold = 0.0;

    private int defaultListLimit = 10;
    private int maxListLimit = 30;

    /** Seed for the placeholder vector used by list, get and health probes. */
    private long placeholderSeed = 42L;
  }

  @Data
  public static class Validation {
    private long maxFileSizeMb = 50;
    private long maxBatchSizeMb = 200;
    private List<String> allowedFileTypes =
        new ArrayList<>(Arrays.asList("text/*", "application/pdf", "image/*"));
    private List<String> blockedFileExtensions =
        new ArrayList<>(
            Arrays.asList(".exe", ".bat", ".cmd", ".scr", ".com", ".pif", ".dll", ".sys"));
    private boolean allowEmptyFiles = false;

    public long maxFileSizeBytes() {
      return maxFileSizeMb * 1024 * 1024;
    }

    public long maxBatchSizeBytes() {
      return maxBatchSizeMb * 1024 * 1024;
    }
  }

  @Data
  public static class Performance {
    private int apiCallTimeoutSeconds = 60;
    private boolean enableEmbeddingCache = false;
    private long cacheTtlSeconds = 3600;
    private long maxCacheSize = 1000;
  }
}
