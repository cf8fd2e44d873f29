package com.s3vectors.filesearch.service.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import com.s3vectors.filesearch.config.VectorServiceProperties;
import com.s3vectors.filesearch.dto.ValidationConfigResponse;
import com.s3vectors.filesearch.exception.FileValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides which files may be uploaded before any embedding or backend work happens. Stateless
 * and side-effect free apart from reading file attributes.
 */
@Slf4j
@Service
public class FileValidationService {

  public static final String DEFAULT_CONTENT_TYPE = MediaType.APPLICATION_OCTET_STREAM_VALUE;

  private static final String UNIVERSAL_WILDCARD = "*/*";

  private final long maxFileSize;
  private final long maxBatchSize;
  private final boolean allowEmptyFiles;
  private final Set<String> allowedMimeTypes;
  private final Set<String> blockedExtensions;

  public FileValidationService(VectorServiceProperties properties) {
    VectorServiceProperties.Validation config = properties.getValidation();
    this.maxFileSize = config.maxFileSizeBytes();
    this.maxBatchSize = config.maxBatchSizeBytes();
    this.allowEmptyFiles = config.isAllowEmptyFiles();
    this.allowedMimeTypes = parseAllowedTypes(config.getAllowedFileTypes());
    this.blockedExtensions = parseBlockedExtensions(config.getBlockedFileExtensions());

    log.info(
        "File validation initialized: max_size={}MB, max_batch={}MB, allowed_types={}, blocked_extensions={}",
        config.getMaxFileSizeMb(),
        config.getMaxBatchSizeMb(),
        allowedMimeTypes.size(),
        blockedExtensions.size());
  }

  /**
   * Validate one file. Rules run in order and the first failure wins: existence, regular file,
   * size, blocked extension, allowed MIME type.
   */
  public ValidationVerdict validate(FileCandidate candidate) {
    Path path = candidate.getPath();

    if (!Files.exists(path) || !Files.isReadable(path)) {
      return ValidationVerdict.failed(
          path, ValidationFailureKind.NOT_FOUND, "File not found: " + path);
    }

    if (!Files.isRegularFile(path)) {
      return ValidationVerdict.failed(
          path, ValidationFailureKind.INVALID_PATH, "Path is not a file: " + path);
    }

    String fileName = path.getFileName().toString();
    long fileSize;
    try {
      fileSize = Files.size(path);
    } catch (IOException e) {
      return ValidationVerdict.failed(
          path, ValidationFailureKind.NOT_FOUND, "File is not readable: " + path);
    }

    if (fileSize > maxFileSize) {
      return ValidationVerdict.failed(
          path,
          ValidationFailureKind.SIZE_EXCEEDED,
          String.format(
              "File size (%.1fMB) exceeds maximum allowed size (%.1fMB): %s",
              toMegabytes(fileSize), toMegabytes(maxFileSize), fileName));
    }

    if (fileSize == 0 && !allowEmptyFiles) {
      return ValidationVerdict.failed(
          path, ValidationFailureKind.EMPTY, "File is empty: " + fileName);
    }

    String extension = extensionOf(fileName);
    if (!extension.isEmpty() && blockedExtensions.contains(extension)) {
      return ValidationVerdict.failed(
          path,
          ValidationFailureKind.BLOCKED_EXTENSION,
          String.format(
              "File extension '%s' is not allowed for security reasons: %s", extension, fileName));
    }

    String contentType = resolveContentType(fileName, candidate.getDeclaredContentType());
    if (!isMimeTypeAllowed(contentType)) {
      return ValidationVerdict.failed(
          path,
          ValidationFailureKind.DISALLOWED_TYPE,
          String.format(
              "File type '%s' is not allowed. Allowed types: %s",
              contentType, String.join(", ", new TreeSet<>(allowedMimeTypes))));
    }

    return ValidationVerdict.builder()
        .passed(true)
        .filePath(path)
        .fileName(fileName)
        .fileSize(fileSize)
        .extension(extension)
        .contentType(contentType)
        .build();
  }

  /** Validate one file and throw when it is rejected. */
  public ValidationVerdict requireValid(FileCandidate candidate) {
    ValidationVerdict verdict = validate(candidate);
    if (!verdict.isPassed()) {
      log.warn("File rejected ({}): {}", verdict.getFailureKind(), verdict.getFailureReason());
      throw new FileValidationException(verdict.getFailureKind(), verdict.getFailureReason());
    }
    return verdict;
  }

  /**
   * Validate every file of a batch, then check the summed size of the files that passed. An
   * oversized batch is rejected as a whole.
   */
  public BatchVerdict validateBatch(List<FileCandidate> candidates) {
    List<ValidationVerdict> verdicts = new ArrayList<>();
    List<ValidationVerdict> valid = new ArrayList<>();
    List<ValidationVerdict> invalid = new ArrayList<>();
    long totalSize = 0;

    for (FileCandidate candidate : candidates) {
      ValidationVerdict verdict = validate(candidate);
      verdicts.add(verdict);
      if (verdict.isPassed()) {
        valid.add(verdict);
        totalSize += verdict.getFileSize();
      } else {
        invalid.add(verdict);
      }
    }

    BatchVerdict.BatchVerdictBuilder builder =
        BatchVerdict.builder()
            .verdicts(verdicts)
            .validFiles(valid)
            .invalidFiles(invalid)
            .totalFiles(candidates.size())
            .totalSizeBytes(totalSize);

    if (totalSize > maxBatchSize) {
      String reason =
          String.format(
              "Total batch size (%.1fMB) exceeds maximum allowed batch size (%.1fMB)",
              toMegabytes(totalSize), toMegabytes(maxBatchSize));
      log.warn("Batch of {} files rejected: {}", candidates.size(), reason);
      builder.batchRejected(true).batchFailureReason(reason);
    }

    return builder.build();
  }

  /**
   * A type is allowed when it is listed exactly, when its main type is listed as {@code main/*},
   * or when {@code *}{@code /*} is listed.
   */
  public boolean isMimeTypeAllowed(String contentType) {
    if (contentType == null) {
      return false;
    }
    String normalized = contentType.trim().toLowerCase(Locale.ROOT);
    if (allowedMimeTypes.contains(normalized)) {
      return true;
    }
    int slash = normalized.indexOf('/');
    String mainType = slash >= 0 ? normalized.substring(0, slash) : normalized;
    if (allowedMimeTypes.contains(mainType + "/*")) {
      return true;
    }
    return allowedMimeTypes.contains(UNIVERSAL_WILDCARD);
  }

  /**
   * Use the declared type when present, otherwise infer it from the file name, falling back to
   * {@code application/octet-stream}.
   */
  public String resolveContentType(String fileName, String declaredContentType) {
    if (declaredContentType != null && !declaredContentType.isBlank()) {
      return stripParameters(declaredContentType);
    }
    return MediaTypeFactory.getMediaType(fileName)
        .map(mediaType -> mediaType.getType() + "/" + mediaType.getSubtype())
        .map(type -> type.toLowerCase(Locale.ROOT))
        .orElse(DEFAULT_CONTENT_TYPE);
  }

  public ValidationConfigResponse describeConfiguration() {
    return ValidationConfigResponse.builder()
        .maxFileSizeMb(Math.round(toMegabytes(maxFileSize) * 10) / 10.0)
        .maxBatchSizeMb(Math.round(toMegabytes(maxBatchSize) * 10) / 10.0)
        .allowEmptyFiles(allowEmptyFiles)
        .allowedMimeTypes(new ArrayList<>(new TreeSet<>(allowedMimeTypes)))
        .blockedExtensions(new ArrayList<>(new TreeSet<>(blockedExtensions)))
        .build();
  }

  static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static String stripParameters(String contentType) {
    int semicolon = contentType.indexOf(';');
    String type = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    return type.trim().toLowerCase(Locale.ROOT);
  }

  private static Set<String> parseAllowedTypes(Collection<String> types) {
    return types.stream()
        .map(String::trim)
        .filter(type -> !type.isEmpty())
        .map(type -> type.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }

  private static Set<String> parseBlockedExtensions(Collection<String> extensions) {
    return extensions.stream()
        .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
        .filter(ext -> !ext.isEmpty())
        .map(ext -> ext.startsWith(".") ? ext : "." + ext)
        .collect(Collectors.toSet());
  }

  private static double toMegabytes(long bytes) {
    return bytes / 1024.0 / 1024.0;
  }
}
