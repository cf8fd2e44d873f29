package com.s3vectors.filesearch.service.vector;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** A raw backend query hit: the key, its distance to the query vector and its metadata. */
@Value
@Builder
public class VectorMatch {

  String key;
  double distance;
  Map<String, String> metadata;
}
