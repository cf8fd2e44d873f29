package com.s3vectors.filesearch.service.vector;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchUploadResult {

  List<UploadedFile> uploaded;
  List<FailedUpload> failed;
  int totalFiles;
  int successCount;
}
