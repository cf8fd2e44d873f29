package com.s3vectors.filesearch.service.vector;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.s3vectors.filesearch.config.VectorServiceProperties;
import com.s3vectors.filesearch.exception.BackendFailureKind;
import com.s3vectors.filesearch.exception.FileValidationException;
import com.s3vectors.filesearch.exception.VectorBackendException;
import com.s3vectors.filesearch.service.embedding.EmbeddingService;
import com.s3vectors.filesearch.service.storage.SourceFileArchive;
import com.s3vectors.filesearch.service.validation.BatchVerdict;
import com.s3vectors.filesearch.service.validation.FileCandidate;
import com.s3vectors.filesearch.service.validation.FileValidationService;
import com.s3vectors.filesearch.service.validation.ValidationVerdict;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps file upload, query, list, get, delete and health operations onto the vector index.
 *
 * <p>Listing and lookup by key are best effort: the index has no enumeration primitive, so both
 * run a similarity query against a fixed placeholder vector and only see the first {@code
 * max-list-limit} results, in similarity order rather than upload order.
 */
@Slf4j
@Service
public class VectorStorageService {

  public static final String FILE_NAME = "file_name";
  public static final String FILE_SIZE = "file_size";
  public static final String CONTENT_TYPE = "content_type";
  public static final String EMBEDDING_MODEL = "embedding_model";
  public static final String UPLOADED_AT = "uploaded_at";
  public static final String SOURCE_FILE_PATH = "source_file_path";

  private final FileValidationService validationService;
  private final EmbeddingService embeddingService;
  private final VectorIndexBackend backend;
  private final SourceFileArchive sourceFileArchive;
  private final VectorServiceProperties.Vector vectorConfig;
  private final String region;
  private final List<Float> placeholderVector;

  public VectorStorageService(
      FileValidationService validationService,
      EmbeddingService embeddingService,
      VectorIndexBackend backend,
      SourceFileArchive sourceFileArchive,
      VectorServiceProperties properties) {
    this.validationService = validationService;
    this.embeddingService = embeddingService;
    this.backend = backend;
    this.sourceFileArchive = sourceFileArchive;
    this.vectorConfig = properties.getVector();
    this.region = properties.getAws().effectiveBucketRegion();
    this.placeholderVector =
        PlaceholderVector.create(vectorConfig.getDimension(), vectorConfig.getPlaceholderSeed());
  }

  /**
   * Validate, embed and store one file.
   *
   * @throws FileValidationException when the file is rejected; the backend is not contacted
   */
  public UploadedFile uploadFile(Path path, Map<String, Object> metadata, String contentType) {
    long start = System.currentTimeMillis();

    ValidationVerdict verdict =
        validationService.requireValid(FileCandidate.of(path, contentType));

    String key = UUID.randomUUID().toString();
    List<Float> embedding = embeddingService.embedFile(path, verdict.getContentType());
    Map<String, String> vectorMetadata = buildMetadata(verdict, metadata);

    backend.putVectors(
        List.of(
            VectorRecord.builder().key(key).vector(embedding).metadata(vectorMetadata).build()));

    sourceFileArchive.archive(key, path, verdict.getContentType(), vectorMetadata);

    long elapsed = System.currentTimeMillis() - start;
    log.info(
        "Successfully uploaded file {} with vector key {} in {}ms",
        verdict.getFileName(),
        key,
        elapsed);

    return toUploadedFile(key, verdict, embedding.size(), elapsed);
  }

  /**
   * Upload several files. An oversized batch fails every file without further work. Otherwise each
   * file is validated and embedded on its own, and all embedded vectors are written in a single
   * backend call; if that call fails, every file it carried is reported as failed.
   */
  public BatchUploadResult uploadBatch(List<FileUploadItem> files) {
    List<FileCandidate> candidates =
        files.stream()
            .map(file -> FileCandidate.of(file.getPath(), file.getContentType()))
            .collect(Collectors.toList());

    BatchVerdict batchVerdict = validationService.validateBatch(candidates);

    List<UploadedFile> uploaded = new ArrayList<>();
    List<FailedUpload> failed = new ArrayList<>();

    if (batchVerdict.isBatchRejected()) {
      for (FileUploadItem file : files) {
        failed.add(
            FailedUpload.builder()
                .filePath(file.getPath().toString())
                .error(batchVerdict.getBatchFailureReason())
                .failureKind(batchVerdict.getBatchFailureKind().name())
                .build());
      }
      return BatchUploadResult.builder()
          .uploaded(uploaded)
          .failed(failed)
          .totalFiles(files.size())
          .successCount(0)
          .build();
    }

    for (ValidationVerdict invalid : batchVerdict.getInvalidFiles()) {
      failed.add(
          FailedUpload.builder()
              .filePath(invalid.getFilePath().toString())
              .error(invalid.getFailureReason())
              .failureKind(invalid.getFailureKind().name())
              .build());
    }

    List<ValidationVerdict> verdicts = batchVerdict.getVerdicts();
    List<VectorRecord> records = new ArrayList<>();
    List<ValidationVerdict> embedded = new ArrayList<>();

    for (int i = 0; i < files.size(); i++) {
      FileUploadItem file = files.get(i);
      ValidationVerdict verdict = verdicts.get(i);
      if (!verdict.isPassed()) {
        continue;
      }
      try {
        String key = UUID.randomUUID().toString();
        List<Float> embedding = embeddingService.embedFile(file.getPath(), verdict.getContentType());
        records.add(
            VectorRecord.builder()
                .key(key)
                .vector(embedding)
                .metadata(buildMetadata(verdict, file.getMetadata()))
                .build());
        embedded.add(verdict);
      } catch (RuntimeException e) {
        log.warn("Embedding failed for {}: {}", file.getPath(), e.getMessage());
        failed.add(
            FailedUpload.builder().filePath(file.getPath().toString()).error(e.getMessage()).build());
      }
    }

    if (!records.isEmpty()) {
      try {
        backend.putVectors(records);
        for (int i = 0; i < records.size(); i++) {
          VectorRecord record = records.get(i);
          ValidationVerdict verdict = embedded.get(i);
          sourceFileArchive.archive(
              record.getKey(), verdict.getFilePath(), verdict.getContentType(), record.getMetadata());
          uploaded.add(toUploadedFile(record.getKey(), verdict, record.getVector().size(), 0));
        }
      } catch (VectorBackendException e) {
        log.error("Batch vector upload failed: {}", e.getMessage());
        for (ValidationVerdict verdict : embedded) {
          failed.add(
              FailedUpload.builder()
                  .filePath(verdict.getFilePath().toString())
                  .error(e.getMessage())
                  .build());
        }
      }
    }

    log.info("Batch upload finished: {}/{} files stored", uploaded.size(), files.size());
    return BatchUploadResult.builder()
        .uploaded(uploaded)
        .failed(failed)
        .totalFiles(files.size())
        .successCount(uploaded.size())
        .build();
  }

  /**
   * Run a similarity query. Top-k is clamped to the configured maximum; hits below the threshold
   * are dropped while the backend's order is kept.
   *
   * @throws IllegalArgumentException unless exactly one of vector and text is given
   */
  public QueryResult query(QuerySpec request) {
    boolean hasVector = request.getVector() != null;
    boolean hasText = request.getText() != null;
    if (hasVector == hasText) {
      throw new IllegalArgumentException(
          hasVector
              ? "Provide either a query vector or query text, not both"
              : "Either a query vector or query text must be provided");
    }

    long start = System.currentTimeMillis();
    List<Float> queryVector =
        hasVector ? request.getVector() : embeddingService.embedText(request.getText());

    int requestedTopK =
        request.getTopK() != null ? request.getTopK() : vectorConfig.getDefaultTopK();
    if (requestedTopK < 1) {
      throw new IllegalArgumentException("top_k must be at least 1");
    }
    int effectiveTopK = Math.min(requestedTopK, vectorConfig.getMaxTopK());
    if (effectiveTopK < requestedTopK) {
      log.warn("Requested top_k {} clamped to maximum {}", requestedTopK, effectiveTopK);
    }

    double threshold =
        request.getSimilarityThreshold() != null
            ? request.getSimilarityThreshold()
            : vectorConfig.getDefaultSimilarityThreshold();

    List<VectorMatch> hits;
    try {
      hits = backend.queryVectors(queryVector, effectiveTopK, request.getMetadataFilter());
    } catch (VectorBackendException e) {
      if (!e.isEmptyIndexNoise()) {
        throw e;
      }
      // A dimension complaint only means "empty index" when the query has the index dimension.
      if (queryVector.size() != vectorConfig.getDimension()) {
        throw new VectorBackendException(
            BackendFailureKind.VALIDATION,
            String.format(
                "Query vector dimension %d does not match index dimension %d",
                queryVector.size(), vectorConfig.getDimension()),
            e);
      }
      log.info("Query against an empty index returned no results");
      hits = List.of();
    }

    List<ScoredFile> matches = new ArrayList<>();
    for (VectorMatch hit : hits) {
      double similarity = 1.0 - hit.getDistance();
      if (similarity < threshold) {
        continue;
      }
      matches.add(
          ScoredFile.builder()
              .key(hit.getKey())
              .similarityScore(similarity)
              .metadata(hit.getMetadata())
              .build());
    }

    long elapsed = System.currentTimeMillis() - start;
    log.info("Vector query completed in {}ms, found {} results", elapsed, matches.size());

    return QueryResult.builder()
        .matches(matches)
        .requestedTopK(requestedTopK)
        .effectiveTopK(effectiveTopK)
        .topKClamped(effectiveTopK < requestedTopK)
        .vectorDimension(queryVector.size())
        .queryTimeMs(elapsed)
        .build();
  }

  /**
   * Best-effort listing of stored files. Not complete once the index holds more vectors than the
   * list limit, and ordered by similarity to a placeholder vector.
   */
  public List<FileSummary> listFiles(Integer limit) {
    int requested = limit != null ? limit : vectorConfig.getDefaultListLimit();
    int effective = Math.max(1, Math.min(requested, vectorConfig.getMaxListLimit()));
    if (effective != requested) {
      log.warn("List limit {} adjusted to {}", requested, effective);
    }

    return placeholderQuery(effective).stream().map(this::toSummary).collect(Collectors.toList());
  }

  /**
   * Look a file up by key. Same completeness caveat as {@link #listFiles(Integer)}: a stored key
   * outside the result cap is reported as absent.
   */
  public Optional<FileSummary> getFile(String key) {
    return placeholderQuery(vectorConfig.getMaxListLimit()).stream()
        .filter(match -> key.equals(match.getKey()))
        .findFirst()
        .map(this::toSummary);
  }

  public DeleteOutcome deleteFile(String key) {
    Optional<String> fileName = Optional.empty();
    if (sourceFileArchive.isEnabled()) {
      fileName = getFile(key).map(FileSummary::getFileName);
    }

    DeleteOutcome outcome = backend.deleteVector(key);
    switch (outcome) {
      case DELETED:
        log.info("Deleted vector {}", key);
        fileName.ifPresent(name -> sourceFileArchive.remove(key, name));
        break;
      case NOT_SUPPORTED:
        log.warn("Delete of {} not performed: backend deletion unsupported", key);
        break;
      case NOT_FOUND:
        log.info("Delete requested for unknown vector {}", key);
        break;
      default:
        break;
    }
    return outcome;
  }

  /**
   * Probe the embedding model and the backend. An empty-index validation error from the backend
   * still proves connectivity and counts as healthy.
   */
  public HealthReport healthCheck() {
    HealthReport.HealthReportBuilder report =
        HealthReport.builder()
            .embeddingModel(embeddingService.getModelId())
            .vectorBucketName(backend.bucketName())
            .vectorIndexName(backend.indexName())
            .region(region);

    List<String> errors = new ArrayList<>();

    boolean embeddingHealthy = false;
    try {
      List<Float> probe = embeddingService.embedText("test");
      report.vectorDimension(probe.size());
      embeddingHealthy = true;
    } catch (RuntimeException e) {
      log.error("Health check: embedding service unavailable: {}", e.getMessage());
      errors.add("embedding: " + e.getMessage());
    }

    boolean backendHealthy = false;
    try {
      backend.queryVectors(placeholderVector, 1, null);
      backendHealthy = true;
    } catch (VectorBackendException e) {
      if (e.isEmptyIndexNoise()) {
        backendHealthy = true;
        report.backendNote("index is empty");
      } else {
        log.error("Health check: vector backend unavailable: {}", e.getMessage());
        errors.add("backend: " + e.getMessage());
      }
    }

    return report
        .embeddingServiceHealthy(embeddingHealthy)
        .backendHealthy(backendHealthy)
        .status(embeddingHealthy && backendHealthy ? HealthReport.HEALTHY : HealthReport.UNHEALTHY)
        .error(errors.isEmpty() ? null : String.join("; ", errors))
        .build();
  }

  private List<VectorMatch> placeholderQuery(int topK) {
    try {
      return backend.queryVectors(placeholderVector, topK, null);
    } catch (VectorBackendException e) {
      if (e.isEmptyIndexNoise()) {
        return List.of();
      }
      throw e;
    }
  }

  private Map<String, String> buildMetadata(
      ValidationVerdict verdict, Map<String, Object> callerMetadata) {
    Map<String, String> metadata = new LinkedHashMap<>();
    if (callerMetadata != null) {
      callerMetadata.forEach(
          (key, value) -> {
            if (value != null) {
              metadata.put(key, String.valueOf(value));
            }
          });
    }
    metadata.put(FILE_NAME, verdict.getFileName());
    metadata.put(FILE_SIZE, String.valueOf(verdict.getFileSize()));
    metadata.put(CONTENT_TYPE, verdict.getContentType());
    metadata.put(EMBEDDING_MODEL, embeddingService.getModelId());
    metadata.put(UPLOADED_AT, Instant.now().truncatedTo(ChronoUnit.MILLIS).toString());
    metadata.put(SOURCE_FILE_PATH, verdict.getFilePath().toString());
    return metadata;
  }

  private FileSummary toSummary(VectorMatch match) {
    Map<String, String> metadata = match.getMetadata();
    return FileSummary.builder()
        .key(match.getKey())
        .fileName(metadata.getOrDefault(FILE_NAME, "unknown"))
        .fileSize(parseSize(metadata.get(FILE_SIZE)))
        .contentType(metadata.get(CONTENT_TYPE))
        .uploadedAt(metadata.get(UPLOADED_AT))
        .embeddingModel(metadata.get(EMBEDDING_MODEL))
        .metadata(metadata)
        .build();
  }

  private static long parseSize(String value) {
    if (value == null) {
      return 0L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.debug("Unparseable file_size metadata: {}", value);
      return 0L;
    }
  }

  private static UploadedFile toUploadedFile(
      String key, ValidationVerdict verdict, int dimension, long elapsedMs) {
    return UploadedFile.builder()
        .key(key)
        .filePath(verdict.getFilePath().toString())
        .fileName(verdict.getFileName())
        .fileSize(verdict.getFileSize())
        .contentType(verdict.getContentType())
        .vectorDimension(dimension)
        .uploadTimeMs(elapsedMs)
        .build();
  }
}
