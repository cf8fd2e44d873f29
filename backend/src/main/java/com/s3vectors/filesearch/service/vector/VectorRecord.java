package com.s3vectors.filesearch.service.vector;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** One stored vector: a unique key, its embedding and string-valued metadata. */
@Value
@Builder
public class VectorRecord {

  String key;
  List<Float> vector;
  Map<String, String> metadata;
}
