package com.s3vectors.filesearch.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The validation limits currently in force. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationConfigResponse {

  @JsonProperty("max_file_size_mb")
  private double maxFileSizeMb;

  @JsonProperty("max_batch_size_mb")
  private double maxBatchSizeMb;

  @JsonProperty("allow_empty_files")
  private boolean allowEmptyFiles;

  @JsonProperty("allowed_mime_types")
  private List<String> allowedMimeTypes;

  @JsonProperty("blocked_extensions")
  private List<String> blockedExtensions;
}
