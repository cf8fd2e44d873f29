package com.s3vectors.filesearch.service.vector;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** Stored file as reconstructed from vector metadata. */
@Value
@Builder
public class FileSummary {

  String key;
  String fileName;
  long fileSize;
  String contentType;
  String uploadedAt;
  String embeddingModel;
  Map<String, String> metadata;
}
