package com.s3vectors.filesearch.service.vector;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Input to a similarity query. Exactly one of {@link #vector} and {@link #text} must be set;
 * {@link #topK} and {@link #similarityThreshold} fall back to configured defaults when null.
 */
@Value
@Builder
public class QuerySpec {

  List<Float> vector;
  String text;
  Integer topK;
  Double similarityThreshold;
  Map<String, Object> metadataFilter;

  public static QuerySpec ofText(String text) {
    return QuerySpec.builder().text(text).build();
  }

  public static QuerySpec ofVector(List<Float> vector) {
    return QuerySpec.builder().vector(vector).build();
  }
}
