package com.s3vectors.filesearch.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Similarity query. Exactly one of {@code query_vector} and {@code query_text} is required. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @JsonProperty("query_vector")
  private List<Float> queryVector;

  @Schema(description = "Text to embed and search with", example = "quarterly revenue report")
  @JsonProperty("query_text")
  private String queryText;

  @Min(1)
  @Schema(description = "Maximum number of results; larger values are clamped")
  @JsonProperty("top_k")
  private Integer topK;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  @JsonProperty("similarity_threshold")
  private Double similarityThreshold;

  @JsonProperty("metadata_filter")
  private Map<String, Object> metadataFilter;
}
