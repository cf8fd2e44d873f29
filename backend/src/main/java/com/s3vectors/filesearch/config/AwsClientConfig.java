package com.s3vectors.filesearch.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.s3vectors.filesearch.service.embedding.BedrockTitanEmbeddingFunction;
import com.s3vectors.filesearch.service.embedding.EmbeddingFunction;
import com.s3vectors.filesearch.service.vector.InMemoryVectorIndexBackend;
import com.s3vectors.filesearch.service.vector.S3VectorsIndexBackend;
import com.s3vectors.filesearch.service.vector.VectorIndexBackend;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3vectors.S3VectorsClient;

/**
 * AWS SDK clients and the beans built on them. Clients are created once at start-up and shared;
 * they are thread safe.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AwsClientConfig {

  private final VectorServiceProperties properties;

  @Bean
  public AwsCredentialsProvider awsCredentialsProvider() {
    VectorServiceProperties.Aws aws = properties.getAws();

    if (hasText(aws.getAccessKeyId()) && hasText(aws.getSecretAccessKey())) {
      log.info("Using static AWS credentials from configuration");
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(aws.getAccessKeyId(), aws.getSecretAccessKey()));
    }
    if (hasText(aws.getProfile())) {
      log.info("Using AWS profile: {}", aws.getProfile());
      return ProfileCredentialsProvider.create(aws.getProfile());
    }
    log.info("Using default AWS credentials provider chain");
    return DefaultCredentialsProvider.create();
  }

  @Bean
  public BedrockRuntimeClient bedrockRuntimeClient(AwsCredentialsProvider credentialsProvider) {
    return BedrockRuntimeClient.builder()
        .region(Region.of(properties.getAws().getRegion()))
        .credentialsProvider(credentialsProvider)
        .overrideConfiguration(clientOverrides())
        .build();
  }

  @Bean
  public EmbeddingFunction embeddingFunction(
      BedrockRuntimeClient bedrockRuntimeClient, ObjectMapper objectMapper) {
    log.info("Embedding model: {}", properties.getEmbedding().getModelId());
    return new BedrockTitanEmbeddingFunction(
        bedrockRuntimeClient,
        objectMapper,
        properties.getEmbedding().getModelId(),
        properties.getVector().getDimension(),
        properties.getEmbedding().isNormalize());
  }

  /** The vector index. S3 Vectors is addressed in the bucket region, which may differ. */
  @Bean
  public VectorIndexBackend vectorIndexBackend(AwsCredentialsProvider credentialsProvider) {
    VectorServiceProperties.Aws aws = properties.getAws();

    if (properties.getBackend().getType() == VectorServiceProperties.BackendType.MEMORY) {
      return new InMemoryVectorIndexBackend(
          properties.getVector().getDimension(), aws.getVectorIndexName());
    }

    S3VectorsClient client =
        S3VectorsClient.builder()
            .region(Region.of(aws.effectiveBucketRegion()))
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(clientOverrides())
            .build();
    return new S3VectorsIndexBackend(
        client,
        aws.getVectorBucketName(),
        aws.getVectorIndexName(),
        properties.getBackend().isDeleteSupported());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "vector-service.backend",
      name = "archive-source-files",
      havingValue = "true")
  public S3Client archiveS3Client(AwsCredentialsProvider credentialsProvider) {
    return S3Client.builder()
        .region(Region.of(properties.getAws().effectiveBucketRegion()))
        .credentialsProvider(credentialsProvider)
        .overrideConfiguration(clientOverrides())
        .build();
  }

  private ClientOverrideConfiguration clientOverrides() {
    return ClientOverrideConfiguration.builder()
        .apiCallTimeout(Duration.ofSeconds(properties.getPerformance().getApiCallTimeoutSeconds()))
        .build();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
