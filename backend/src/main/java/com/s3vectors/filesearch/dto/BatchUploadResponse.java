package com.s3vectors.filesearch.dto;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.s3vectors.filesearch.service.vector.BatchUploadResult;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchUploadResponse {

  @JsonProperty("uploaded_files")
  private List<UploadResponse> uploadedFiles;

  @JsonProperty("failed_files")
  private List<FailedFile> failedFiles;

  @JsonProperty("total_files")
  private int totalFiles;

  @JsonProperty("success_count")
  private int successCount;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class FailedFile {

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("error")
    private String error;

    @JsonProperty("failure_kind")
    private String failureKind;
  }

  public static BatchUploadResponse from(BatchUploadResult result) {
    return BatchUploadResponse.builder()
        .uploadedFiles(
            result.getUploaded().stream().map(UploadResponse::from).collect(Collectors.toList()))
        .failedFiles(
            result.getFailed().stream()
                .map(
                    failed ->
                        FailedFile.builder()
                            .filePath(failed.getFilePath())
                            .error(failed.getError())
                            .failureKind(failed.getFailureKind())
                            .build())
                .collect(Collectors.toList()))
        .totalFiles(result.getTotalFiles())
        .successCount(result.getSuccessCount())
        .build();
  }
}
