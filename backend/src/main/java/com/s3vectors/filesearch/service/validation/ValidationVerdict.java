package com.s3vectors.filesearch.service.validation;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Value;

/** Outcome of validating a single {@link FileCandidate}. */
@Value
@Builder
public class ValidationVerdict {

  boolean passed;
  Path filePath;
  String fileName;
  long fileSize;
  String extension;
  String contentType;
  ValidationFailureKind failureKind;
  String failureReason;

  static ValidationVerdict failed(Path path, ValidationFailureKind kind, String reason) {
    return ValidationVerdict.builder()
        .passed(false)
        .filePath(path)
        .fileName(path.getFileName() != null ? path.getFileName().toString() : path.toString())
        .failureKind(kind)
        .failureReason(reason)
        .build();
  }
}
