package com.s3vectors.filesearch.service.validation;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Result of validating a batch. When {@link #isBatchRejected()} is true the whole batch must be
 * refused, even if every individual file passed.
 */
@Value
@Builder
public class BatchVerdict {

  /** Every verdict, in the order of the candidates. */
  List<ValidationVerdict> verdicts;

  List<ValidationVerdict> validFiles;
  List<ValidationVerdict> invalidFiles;
  int totalFiles;
  long totalSizeBytes;
  boolean batchRejected;
  String batchFailureReason;

  public ValidationFailureKind getBatchFailureKind() {
    return batchRejected ? ValidationFailureKind.BATCH_TOO_LARGE : null;
  }
}
