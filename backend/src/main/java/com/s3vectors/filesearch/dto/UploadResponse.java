package com.s3vectors.filesearch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.s3vectors.filesearch.service.vector.UploadedFile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  @JsonProperty("file_id")
  private String fileId;

  @JsonProperty("file_name")
  private String fileName;

  @JsonProperty("file_size")
  private long fileSize;

  @JsonProperty("content_type")
  private String contentType;

  @JsonProperty("vector_dimension")
  private int vectorDimension;

  @JsonProperty("upload_time_ms")
  private long uploadTimeMs;

  public static UploadResponse from(UploadedFile file) {
    return UploadResponse.builder()
        .fileId(file.getKey())
        .fileName(file.getFileName())
        .fileSize(file.getFileSize())
        .contentType(file.getContentType())
        .vectorDimension(file.getVectorDimension())
        .uploadTimeMs(file.getUploadTimeMs())
        .build();
  }
}
