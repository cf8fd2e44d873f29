package com.s3vectors.filesearch.service.embedding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import com.google.common.base.CharMatcher;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.s3vectors.filesearch.config.VectorServiceProperties;
import com.s3vectors.filesearch.exception.EmbeddingException;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns text and files into embedding vectors. Owns text preprocessing (whitespace collapsing and
 * truncation) and the per-content-kind extraction of text from files.
 */
@Slf4j
@Service
public class EmbeddingService {

  private static final String DEFAULT_FILE_CONTENT_TYPE = "text/plain";

  private final EmbeddingFunction embeddingFunction;
  private final int maxTextLength;
  private final TextTruncationStrategy truncationStrategy;
  private final Map<ContentKind, ContentExtractor> extractors;

  private Cache<String, List<Float>> embeddingCache;

  public EmbeddingService(EmbeddingFunction embeddingFunction, VectorServiceProperties properties) {
    this.embeddingFunction = embeddingFunction;

    VectorServiceProperties.Vector vector = properties.getVector();
    this.maxTextLength = vector.getMaxTextLength();
    this.truncationStrategy =
        vector.getTruncationStrategy() != null
            ? vector.getTruncationStrategy()
            : TextTruncationStrategy.END;

    ContentExtractor generic = new GenericContentExtractor();
    this.extractors = new EnumMap<>(ContentKind.class);
    extractors.put(ContentKind.TEXT, new TextContentExtractor());
    extractors.put(
        ContentKind.IMAGE,
        new ImageContentExtractor(
            vector.getImageResizeWidth(), vector.getImageResizeHeight(), vector.getImageFormat()));
    extractors.put(ContentKind.PDF, new PdfContentExtractor(generic));
    extractors.put(ContentKind.GENERIC, generic);

    VectorServiceProperties.Performance performance = properties.getPerformance();
    if (performance.isEnableEmbeddingCache()) {
      embeddingCache =
          CacheBuilder.newBuilder()
              .maximumSize(performance.getMaxCacheSize())
              .expireAfterWrite(performance.getCacheTtlSeconds(), TimeUnit.SECONDS)
              .build();
      log.info(
          "Embedding cache enabled (max {} entries, ttl {}s)",
          performance.getMaxCacheSize(),
          performance.getCacheTtlSeconds());
    }
  }

  public String getModelId() {
    return embeddingFunction.modelId();
  }

  /** Collapse whitespace runs, trim, then truncate to the configured length. */
  public String preprocess(String text) {
    if (text == null) {
      return "";
    }
    String collapsed = CharMatcher.whitespace().trimAndCollapseFrom(text, ' ');
    return truncationStrategy.truncate(collapsed, maxTextLength);
  }

  public List<Float> embedText(String text) {
    String prepared = preprocess(text);

    if (embeddingCache != null) {
      List<Float> cached = embeddingCache.getIfPresent(prepared);
      if (cached != null) {
        log.debug("Embedding cache hit for text of length {}", prepared.length());
        return cached;
      }
    }

    List<Float> embedding = invoke(prepared);
    if (embeddingCache != null) {
      embeddingCache.put(prepared, embedding);
    }
    return embedding;
  }

  /**
   * Embed each text independently. The Titan model has no batch endpoint, so this is one call per
   * text.
   */
  public List<List<Float>> embedBatch(List<String> texts) {
    log.debug("Generating embeddings for {} texts", texts.size());
    return texts.stream().map(this::embedText).collect(Collectors.toList());
  }

  /**
   * Embed a file according to its content type. When no type is given it is inferred from the
   * file name, defaulting to plain text.
   */
  public List<Float> embedFile(Path file, String contentType) {
    if (!Files.exists(file)) {
      throw new EmbeddingException("File not found: " + file);
    }

    String resolvedType =
        contentType != null && !contentType.isBlank() ? contentType : inferContentType(file);
    ContentKind kind = ContentKind.fromContentType(resolvedType);

    String text;
    try {
      text = extractors.get(kind).extractText(file);
      if (preprocess(text).isEmpty()) {
        log.debug("{} has no text content, embedding a description instead", file.getFileName());
        text = GenericContentExtractor.describe(file);
      }
    } catch (IOException e) {
      log.error("Error reading {} as {}: {}", file, kind, e.getMessage());
      throw new EmbeddingException(
          String.format("Failed to read %s content from %s", kind, file.getFileName()), e);
    }

    log.debug("Embedding {} as {} ({} characters)", file.getFileName(), kind, text.length());
    return embedText(text);
  }

  /**
   * Cosine similarity clamped to [0, 1]. Zero-magnitude vectors have similarity 0.
   *
   * @throws IllegalArgumentException when the vectors differ in length
   */
  public double similarity(List<Float> first, List<Float> second) {
    if (first.size() != second.size()) {
      throw new IllegalArgumentException("Embeddings must have the same dimension");
    }

    double dotProduct = 0.0;
    double norm1 = 0.0;
    double norm2 = 0.0;
    for (int i = 0; i < first.size(); i++) {
      double a = first.get(i);
      double b = second.get(i);
      dotProduct += a * b;
      norm1 += a * a;
      norm2 += b * b;
    }

    if (norm1 == 0.0 || norm2 == 0.0) {
      return 0.0;
    }

    double cosine = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
    return Math.max(0.0, Math.min(1.0, cosine));
  }

  private List<Float> invoke(String text) {
    try {
      return embeddingFunction.embed(text);
    } catch (EmbeddingException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Error generating text embedding", e);
      throw new EmbeddingException("Failed to generate embedding", e);
    }
  }

  private static String inferContentType(Path file) {
    return MediaTypeFactory.getMediaType(file.getFileName().toString())
        .map(mediaType -> mediaType.getType() + "/" + mediaType.getSubtype())
        .orElse(DEFAULT_FILE_CONTENT_TYPE);
  }
}
