package com.s3vectors.filesearch.service.vector;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/** Query hits in backend order, after threshold filtering. */
@Value
@Builder
public class QueryResult {

  List<ScoredFile> matches;
  int requestedTopK;
  int effectiveTopK;
  boolean topKClamped;
  int vectorDimension;
  long queryTimeMs;
}
