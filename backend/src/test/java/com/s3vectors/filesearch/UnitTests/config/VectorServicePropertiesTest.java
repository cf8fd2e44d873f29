package com.s3vectors.filesearch.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.s3vectors.filesearch.service.embedding.TextTruncationStrategy;

@DisplayName("VectorServiceProperties Tests")
class VectorServicePropertiesTest {

  private VectorServiceProperties properties;

  @BeforeEach
  void setUp() {
    properties = new VectorServiceProperties();
  }

  @Test
  @DisplayName("Should carry the documented defaults")
  void shouldHaveDefaults() {
    assertThat(properties.getAws().getRegion()).isEqualTo("us-east-1");
    assertThat(properties.getAws().getVectorIndexName()).isEqualTo("default-index");
    assertThat(properties.getBackend().getType())
        .isEqualTo(VectorServiceProperties.BackendType.S3VECTORS);
    assertThat(properties.getEmbedding().getModelId()).isEqualTo("amazon.titan-embed-text-v2:0");
    assertThat(properties.getVector().getDimension()).isEqualTo(1024);
    assertThat(properties.getVector().getMaxTextLength()).isEqualTo(512);
    assertThat(properties.getVector().getTruncationStrategy()).isEqualTo(TextTruncationStrategy.END);
    assertThat(properties.getVector().getMaxTopK()).isEqualTo(30);
    assertThat(properties.getValidation().getAllowedFileTypes())
        .containsExactly("text/*", "application/pdf", "image/*");
    assertThat(properties.getValidation().getBlockedFileExtensions()).contains(".exe", ".sys");
    assertThat(properties.getPerformance().isEnableEmbeddingCache()).isFalse();
  }

  @Test
  @DisplayName("Should convert size limits to bytes")
  void shouldConvertSizeLimits() {
    assertThat(properties.getValidation().maxFileSizeBytes()).isEqualTo(50L * 1024 * 1024);
    assertThat(properties.getValidation().maxBatchSizeBytes()).isEqualTo(200L * 1024 * 1024);
  }

  @Test
  @DisplayName("Should fall back to the main region for the bucket")
  void shouldResolveBucketRegion() {
    properties.getAws().setRegion("eu-west-1");
    assertThat(properties.getAws().effectiveBucketRegion()).isEqualTo("eu-west-1");

    properties.getAws().setBucketRegion("us-west-2");
    assertThat(properties.getAws().effectiveBucketRegion()).isEqualTo("us-west-2");
  }

  @Nested
  @DisplayName("Start-up Validation")
  class StartupValidation {

    @Test
    @DisplayName("Should warn about a missing vector bucket for the S3 Vectors backend")
    void shouldWarnAboutMissingBucket() {
      List<String> warnings = new VectorServicePropertiesValidator(properties).findWarnings();

      assertThat(warnings).anyMatch(warning -> warning.contains("vector-bucket-name"));
    }

    @Test
    @DisplayName("Should not warn about the bucket for the in-memory backend")
    void shouldNotWarnForMemoryBackend() {
      properties.getBackend().setType(VectorServiceProperties.BackendType.MEMORY);

      assertThat(new VectorServicePropertiesValidator(properties).findWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should warn about inconsistent limits")
    void shouldWarnAboutInconsistentLimits() {
      properties.getAws().setVectorBucketName("bucket");
      properties.getVector().setDimension(300);
      properties.getVector().setDefaultTopK(50);
      properties.getValidation().setMaxFileSizeMb(500);

      List<String> warnings = new VectorServicePropertiesValidator(properties).findWarnings();

      assertThat(warnings).hasSize(3);
    }
  }
}
