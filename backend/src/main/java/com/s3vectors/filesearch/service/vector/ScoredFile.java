package com.s3vectors.filesearch.service.vector;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** A query hit with its similarity score in [0, 1]. */
@Value
@Builder
public class ScoredFile {

  String key;
  double similarityScore;
  Map<String, String> metadata;
}
