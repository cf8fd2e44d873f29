package com.s3vectors.filesearch.service.vector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthReport {

  public static final String HEALTHY = "healthy";
  public static final String UNHEALTHY = "unhealthy";

  @JsonProperty("status")
  String status;

  @JsonProperty("embedding_service")
  boolean embeddingServiceHealthy;

  @JsonProperty("s3_vectors_connection")
  boolean backendHealthy;

  /** Set when the backend answered with an expected empty-index validation error. */
  @JsonProperty("backend_note")
  String backendNote;

  @JsonProperty("vector_dimension")
  Integer vectorDimension;

  @JsonProperty("embedding_model")
  String embeddingModel;

  @JsonProperty("vector_bucket_name")
  String vectorBucketName;

  @JsonProperty("vector_index_name")
  String vectorIndexName;

  @JsonProperty("region")
  String region;

  @JsonProperty("error")
  String error;

  @JsonIgnore
  public boolean isHealthy() {
    return HEALTHY.equals(status);
  }
}
