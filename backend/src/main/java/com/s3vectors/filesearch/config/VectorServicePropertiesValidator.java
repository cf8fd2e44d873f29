package com.s3vectors.filesearch.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports suspicious configuration at start-up. Never fails the start: the affected operations
 * fail on their own with a clearer error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VectorServicePropertiesValidator {

  private static final List<Integer> TITAN_DIMENSIONS = List.of(256, 512, 1024);

  private final VectorServiceProperties properties;

  @PostConstruct
  public void validateStartup() {
    List<String> warnings = findWarnings();
    warnings.forEach(warning -> log.warn("Configuration: {}", warning));
    if (warnings.isEmpty()) {
      log.debug("Vector service configuration looks consistent");
    }
  }

  List<String> findWarnings() {
    List<String> warnings = new ArrayList<>();
    VectorServiceProperties.Aws aws = properties.getAws();
    VectorServiceProperties.Vector vector = properties.getVector();
    VectorServiceProperties.Validation validation = properties.getValidation();

    if (properties.getBackend().getType() == VectorServiceProperties.BackendType.S3VECTORS
        && (aws.getVectorBucketName() == null || aws.getVectorBucketName().isBlank())) {
      warnings.add(
          "vector-service.aws.vector-bucket-name is not set; S3 Vectors operations will fail");
    }
    if (!TITAN_DIMENSIONS.contains(vector.getDimension())) {
      warnings.add(
          String.format(
              "vector dimension %d is not one of %s supported by Titan Text Embeddings V2",
              vector.getDimension(), TITAN_DIMENSIONS));
    }
    if (validation.getMaxFileSizeMb() > validation.getMaxBatchSizeMb()) {
      warnings.add(
          String.format(
              "max file size (%dMB) is larger than max batch size (%dMB)",
              validation.getMaxFileSizeMb(), validation.getMaxBatchSizeMb()));
    }
    if (vector.getDefaultTopK() > vector.getMaxTopK()) {
      warnings.add(
          String.format(
              "default top-k %d exceeds max top-k %d and will always be clamped",
              vector.getDefaultTopK(), vector.getMaxTopK()));
    }
    if (vector.getDefaultListLimit() > vector.getMaxListLimit()) {
      warnings.add(
          String.format(
              "default list limit %d exceeds max list limit %d",
              vector.getDefaultListLimit(), vector.getMaxListLimit()));
    }
    return warnings;
  }
}
