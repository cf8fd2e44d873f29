package com.s3vectors.filesearch.service.vector;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import com.s3vectors.filesearch.exception.BackendFailureKind;
import com.s3vectors.filesearch.exception.VectorBackendException;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3vectors.S3VectorsClient;
import software.amazon.awssdk.services.s3vectors.model.AccessDeniedException;
import software.amazon.awssdk.services.s3vectors.model.DeleteVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.GetVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.GetVectorsResponse;
import software.amazon.awssdk.services.s3vectors.model.NotFoundException;
import software.amazon.awssdk.services.s3vectors.model.PutInputVector;
import software.amazon.awssdk.services.s3vectors.model.PutVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.QueryVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.QueryVectorsResponse;
import software.amazon.awssdk.services.s3vectors.model.ValidationException;
import software.amazon.awssdk.services.s3vectors.model.VectorData;

/**
 * {@link VectorIndexBackend} on Amazon S3 Vectors. Bucket and index are fixed for the lifetime of
 * the instance.
 */
@Slf4j
public class S3VectorsIndexBackend implements VectorIndexBackend {

  private final S3VectorsClient s3VectorsClient;
  private final String vectorBucketName;
  private final String vectorIndexName;
  private final boolean deleteSupported;

  public S3VectorsIndexBackend(
      S3VectorsClient s3VectorsClient,
      String vectorBucketName,
      String vectorIndexName,
      boolean deleteSupported) {
    if (vectorBucketName == null || vectorBucketName.isBlank()) {
      throw new IllegalArgumentException("A vector bucket name is required for S3 Vectors");
    }
    this.s3VectorsClient = s3VectorsClient;
    this.vectorBucketName = vectorBucketName;
    this.vectorIndexName = vectorIndexName;
    this.deleteSupported = deleteSupported;
    log.info("Using S3 Vectors bucket '{}' index '{}'", vectorBucketName, vectorIndexName);
  }

  @Override
  public void putVectors(List<VectorRecord> records) {
    List<PutInputVector> vectors =
        records.stream()
            .map(
                record ->
                    PutInputVector.builder()
                        .key(record.getKey())
                        .data(VectorData.builder().float32(record.getVector()).build())
                        .metadata(MetadataDocuments.fromStringMap(record.getMetadata()))
                        .build())
            .collect(Collectors.toList());

    try {
      s3VectorsClient.putVectors(
          PutVectorsRequest.builder()
              .vectorBucketName(vectorBucketName)
              .indexName(vectorIndexName)
              .vectors(vectors)
              .build());
      log.debug("Stored {} vectors in index {}", vectors.size(), vectorIndexName);
    } catch (SdkException e) {
      throw translate("put vectors", e);
    }
  }

  @Override
  public List<VectorMatch> queryVectors(List<Float> vector, int topK, Map<String, Object> filter) {
    QueryVectorsRequest.Builder request =
        QueryVectorsRequest.builder()
            .vectorBucketName(vectorBucketName)
            .indexName(vectorIndexName)
            .queryVector(VectorData.builder().float32(vector).build())
            .topK(topK)
            .returnDistance(true)
            .returnMetadata(true);

    if (filter != null && !filter.isEmpty()) {
      request.filter(MetadataDocuments.fromObject(filter));
    }

    QueryVectorsResponse response;
    try {
      response = s3VectorsClient.queryVectors(request.build());
    } catch (SdkException e) {
      throw translate("query vectors", e);
    }

    return response.vectors().stream()
        .map(
            hit ->
                VectorMatch.builder()
                    .key(hit.key())
                    .distance(hit.distance() != null ? hit.distance() : 0.0)
                    .metadata(MetadataDocuments.toStringMap(hit.metadata()))
                    .build())
        .collect(Collectors.toList());
  }

  @Override
  public DeleteOutcome deleteVector(String key) {
    if (!deleteSupported) {
      log.warn(
          "Vector deletion is not supported in this deployment; vector {} was not removed", key);
      return DeleteOutcome.NOT_SUPPORTED;
    }

    try {
      GetVectorsResponse existing =
          s3VectorsClient.getVectors(
              GetVectorsRequest.builder()
                  .vectorBucketName(vectorBucketName)
                  .indexName(vectorIndexName)
                  .keys(key)
                  .returnData(false)
                  .returnMetadata(false)
                  .build());
      if (!existing.hasVectors() || existing.vectors().isEmpty()) {
        return DeleteOutcome.NOT_FOUND;
      }

      s3VectorsClient.deleteVectors(
          DeleteVectorsRequest.builder()
              .vectorBucketName(vectorBucketName)
              .indexName(vectorIndexName)
              .keys(key)
              .build());
      log.info("Deleted vector {} from index {}", key, vectorIndexName);
      return DeleteOutcome.DELETED;
    } catch (SdkException e) {
      throw translate("delete vector " + key, e);
    }
  }

  @Override
  public String bucketName() {
    return vectorBucketName;
  }

  @Override
  public String indexName() {
    return vectorIndexName;
  }

  /**
   * Classify an SDK failure. A validation error about the vector dimension is what S3 Vectors
   * returns for queries against an index that has not received any vectors yet.
   */
  static VectorBackendException translate(String operation, SdkException e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    BackendFailureKind kind;

    if (e instanceof ValidationException) {
      kind =
          message.toLowerCase(Locale.ROOT).contains("dimension")
              ? BackendFailureKind.EMPTY_INDEX_VALIDATION
              : BackendFailureKind.VALIDATION;
    } else if (e instanceof AccessDeniedException) {
      kind = BackendFailureKind.AUTHORIZATION;
    } else if (e instanceof NotFoundException) {
      kind = BackendFailureKind.NOT_FOUND;
    } else if (e instanceof AwsServiceException
        && (((AwsServiceException) e).statusCode() == 401
            || ((AwsServiceException) e).statusCode() == 403)) {
      kind = BackendFailureKind.AUTHORIZATION;
    } else if (e instanceof SdkClientException) {
      kind = BackendFailureKind.CONNECTIVITY;
    } else {
      kind = BackendFailureKind.SERVICE;
    }

    if (kind.isBenign()) {
      log.debug("S3 Vectors {} reported an empty index: {}", operation, message);
    } else {
      log.error("S3 Vectors {} failed ({}): {}", operation, kind, message);
    }
    return new VectorBackendException(kind, "Failed to " + operation + ": " + message, e);
  }
}
