package com.s3vectors.filesearch.service.vector;

import java.util.List;
import java.util.Map;

import com.s3vectors.filesearch.exception.VectorBackendException;

/**
 * Similarity-search store holding vectors of one fixed dimension. Implementations translate
 * their own errors into {@link VectorBackendException}.
 */
public interface VectorIndexBackend {

  /** Write all records in one call. */
  void putVectors(List<VectorRecord> records);

  /**
   * Nearest neighbours of {@code vector}, closest first, with distances and metadata.
   *
   * @param filter exact-match metadata predicate, may be null
   */
  List<VectorMatch> queryVectors(List<Float> vector, int topK, Map<String, Object> filter);

  DeleteOutcome deleteVector(String key);

  String bucketName();

  String indexName();
}
