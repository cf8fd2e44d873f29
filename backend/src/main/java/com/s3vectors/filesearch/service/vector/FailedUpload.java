package com.s3vectors.filesearch.service.vector;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FailedUpload {

  String filePath;
  String error;
  /** Validation failure kind, or null when the file failed during embedding or storage. */
  String failureKind;
}
