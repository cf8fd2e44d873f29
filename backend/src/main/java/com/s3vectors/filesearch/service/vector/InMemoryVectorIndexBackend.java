package com.s3vectors.filesearch.service.vector;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.s3vectors.filesearch.exception.BackendFailureKind;
import com.s3vectors.filesearch.exception.VectorBackendException;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-local {@link VectorIndexBackend} with cosine distance. Used for local runs without AWS
 * and in tests; mirrors the S3 Vectors contract including its dimension checks.
 */
@Slf4j
public class InMemoryVectorIndexBackend implements VectorIndexBackend {

  private final int dimension;
  private final String indexName;
  private final Map<String, VectorRecord> storage = new LinkedHashMap<>();

  public InMemoryVectorIndexBackend(int dimension, String indexName) {
    this.dimension = dimension;
    this.indexName = indexName;
    log.info("Using in-memory vector index '{}' (dimension {})", indexName, dimension);
  }

  @Override
  public synchronized void putVectors(List<VectorRecord> records) {
    for (VectorRecord record : records) {
      if (record.getVector().size() != dimension) {
        throw new VectorBackendException(
            BackendFailureKind.VALIDATION,
            String.format(
                "Invalid vector for key %s: dimension %d does not match index dimension %d",
                record.getKey(), record.getVector().size(), dimension));
      }
    }
    records.forEach(record -> storage.put(record.getKey(), record));
    log.debug("Stored {} vectors in memory", records.size());
  }

  @Override
  public synchronized List<VectorMatch> queryVectors(
      List<Float> vector, int topK, Map<String, Object> filter) {
    if (vector.size() != dimension) {
      BackendFailureKind kind =
          storage.isEmpty()
              ? BackendFailureKind.EMPTY_INDEX_VALIDATION
              : BackendFailureKind.VALIDATION;
      throw new VectorBackendException(
          kind,
          String.format(
              "Query vector dimension %d does not match index dimension %d",
              vector.size(), dimension));
    }

    return storage.values().stream()
        .filter(record -> matchesFilter(record.getMetadata(), filter))
        .map(
            record ->
                VectorMatch.builder()
                    .key(record.getKey())
                    .distance(cosineDistance(vector, record.getVector()))
                    .metadata(Collections.unmodifiableMap(record.getMetadata()))
                    .build())
        .sorted(Comparator.comparingDouble(VectorMatch::getDistance))
        .limit(topK)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized DeleteOutcome deleteVector(String key) {
    return storage.remove(key) != null ? DeleteOutcome.DELETED : DeleteOutcome.NOT_FOUND;
  }

  @Override
  public String bucketName() {
    return "in-memory";
  }

  @Override
  public String indexName() {
    return indexName;
  }

  public synchronized int size() {
    return storage.size();
  }

  private static boolean matchesFilter(Map<String, String> metadata, Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return true;
    }
    return filter.entrySet().stream()
        .allMatch(
            condition ->
                Objects.equals(
                    metadata.get(condition.getKey()), String.valueOf(condition.getValue())));
  }

  private static double cosineDistance(List<Float> a, List<Float> b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      dot += a.get(i) * b.get(i);
      normA += a.get(i) * a.get(i);
      normB += b.get(i) * b.get(i);
    }
    if (normA == 0.0 || normB == 0.0) {
      return 1.0;
    }
    return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
