package com.s3vectors.filesearch.service.vector;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UploadedFile {

  String key;
  String filePath;
  String fileName;
  long fileSize;
  String contentType;
  int vectorDimension;
  long uploadTimeMs;
}
