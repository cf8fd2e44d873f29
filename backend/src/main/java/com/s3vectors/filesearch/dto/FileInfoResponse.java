package com.s3vectors.filesearch.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.s3vectors.filesearch.service.vector.FileSummary;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileInfoResponse {

  @JsonProperty("file_id")
  private String fileId;

  @JsonProperty("file_name")
  private String fileName;

  @JsonProperty("file_size")
  private long fileSize;

  @JsonProperty("content_type")
  private String contentType;

  @JsonProperty("uploaded_at")
  private String uploadedAt;

  @JsonProperty("embedding_model")
  private String embeddingModel;

  @JsonProperty("metadata")
  private Map<String, String> metadata;

  public static FileInfoResponse from(FileSummary summary) {
    return FileInfoResponse.builder()
        .fileId(summary.getKey())
        .fileName(summary.getFileName())
        .fileSize(summary.getFileSize())
        .contentType(summary.getContentType())
        .uploadedAt(summary.getUploadedAt())
        .embeddingModel(summary.getEmbeddingModel())
        .metadata(summary.getMetadata())
        .build();
  }
}
