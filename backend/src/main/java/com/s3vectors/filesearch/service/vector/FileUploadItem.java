package com.s3vectors.filesearch.service.vector;

import java.nio.file.Path;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** One file of an upload request with its caller metadata and optional declared type. */
@Value
@Builder
public class FileUploadItem {

  Path path;
  Map<String, Object> metadata;
  String contentType;
}
