package com.s3vectors.filesearch.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A file on the server's file system to embed and store. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileUploadRequest {

  @NotBlank
  @Schema(description = "Path of the file to upload", example = "/data/docs/report.pdf")
  @JsonProperty("file_path")
  private String filePath;

  @Schema(description = "Additional metadata stored with the vector")
  @JsonProperty("metadata")
  private Map<String, Object> metadata;

  @Schema(description = "MIME type; inferred from the file name when omitted")
  @JsonProperty("content_type")
  private String contentType;
}
