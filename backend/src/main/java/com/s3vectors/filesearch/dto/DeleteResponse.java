package com.s3vectors.filesearch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.s3vectors.filesearch.service.vector.DeleteOutcome;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteResponse {

  @JsonProperty("file_id")
  private String fileId;

  @JsonProperty("outcome")
  private DeleteOutcome outcome;

  @JsonProperty("message")
  private String message;
}
