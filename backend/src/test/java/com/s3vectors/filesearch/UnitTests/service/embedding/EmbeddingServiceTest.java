package com.s3vectors.filesearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import com.s3vectors.filesearch.config.VectorServiceProperties;
import com.s3vectors.filesearch.exception.EmbeddingException;
import com.s3vectors.filesearch.fixtures.TestFixtures;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  private static final List<Float> SAMPLE_EMBEDDING = Arrays.asList(0.1f, 0.2f, 0.3f);

  @Mock private EmbeddingFunction embeddingFunction;

  @TempDir Path tempDir;

  private VectorServiceProperties properties;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    properties = TestFixtures.defaultProperties();
    when(embeddingFunction.modelId()).thenReturn("amazon.titan-embed-text-v2:0");
    when(embeddingFunction.embed(anyString())).thenReturn(SAMPLE_EMBEDDING);
    embeddingService = new EmbeddingService(embeddingFunction, properties);
  }

  @Nested
  @DisplayName("Text Preprocessing")
  class TextPreprocessing {

    @Test
    @DisplayName("Should collapse whitespace and trim")
    void shouldCollapseWhitespace() {
      assertThat(embeddingService.preprocess("  hello \n\n  world\t again  "))
          .isEqualTo("hello world again");
    }

    @Test
    @DisplayName("Should collapse Unicode spaces such as no-break and em space")
    void shouldCollapseUnicodeWhitespace() {
      assertThat(embeddingService.preprocess("\u00A0hello\u2003\u00A0world\u3000"))
          .isEqualTo("hello world");
    }

    @Test
    @DisplayName("Should truncate to the configured length")
    void shouldTruncate() {
      properties.getVector().setMaxTextLength(5);
      EmbeddingService shortService = new EmbeddingService(embeddingFunction, properties);

      assertThat(shortService.preprocess("abcdefghij")).isEqualTo("abcde");
    }

    @Test
    @DisplayName("Should use the configured truncation strategy")
    void shouldUseConfiguredStrategy() {
      properties.getVector().setMaxTextLength(4);
      properties.getVector().setTruncationStrategy(TextTruncationStrategy.START);
      EmbeddingService startService = new EmbeddingService(embeddingFunction, properties);

      assertThat(startService.preprocess("abcdefghij")).isEqualTo("ghij");
    }

    @Test
    @DisplayName("Should treat null as empty text")
    void shouldTreatNullAsEmpty() {
      assertThat(embeddingService.preprocess(null)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Text Embedding")
  class TextEmbedding {

    @Test
    @DisplayName("Should embed the preprocessed text")
    void shouldEmbedPreprocessedText() {
      List<Float> result = embeddingService.embedText("  some   text ");

      assertThat(result).isEqualTo(SAMPLE_EMBEDDING);
      verify(embeddingFunction).embed("some text");
    }

    @Test
    @DisplayName("Should wrap provider failures in EmbeddingException")
    void shouldWrapProviderFailures() {
      when(embeddingFunction.embed(anyString())).thenThrow(new IllegalStateException("throttled"));

      assertThatThrownBy(() -> embeddingService.embedText("text"))
          .isInstanceOf(EmbeddingException.class)
          .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should embed each text of a batch")
    void shouldEmbedBatch() {
      List<List<Float>> results = embeddingService.embedBatch(Arrays.asList("one", "two", "three"));

      assertThat(results).hasSize(3);
      verify(embeddingFunction, times(3)).embed(anyString());
    }

    @Test
    @DisplayName("Should serve repeated texts from the cache when enabled")
    void shouldServeFromCache() {
      properties.getPerformance().setEnableEmbeddingCache(true);
      EmbeddingService cached = new EmbeddingService(embeddingFunction, properties);

      cached.embedText("repeat me");
      cached.embedText("repeat   me");

      verify(embeddingFunction, times(1)).embed("repeat me");
    }

    @Test
    @DisplayName("Should expose the model id")
    void shouldExposeModelId() {
      assertThat(embeddingService.getModelId()).isEqualTo("amazon.titan-embed-text-v2:0");
    }
  }

  @Nested
  @DisplayName("File Embedding")
  class FileEmbedding {

    @Test
    @DisplayName("Should embed text file content")
    void shouldEmbedTextFile() throws IOException {
      Path file = TestFixtures.writeText(tempDir, "doc.txt", "Python is a programming language");

      embeddingService.embedFile(file, "text/plain");

      verify(embeddingFunction).embed("Python is a programming language");
    }

    @Test
    @DisplayName("Should infer the content type from the file name")
    void shouldInferContentType() throws IOException {
      Path file = TestFixtures.writeText(tempDir, "table.csv", "name,age\nada,36");

      embeddingService.embedFile(file, null);

      verify(embeddingFunction).embed("name,age ada,36");
    }

    @Test
    @DisplayName("Should describe binary files of unknown type")
    void shouldDescribeBinaryFiles() throws IOException {
      Path file = tempDir.resolve("blob.bin");
      Files.write(file, new byte[] {(byte) 0xC3, (byte) 0x28, 0x00, (byte) 0xFF});
      ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);

      embeddingService.embedFile(file, "application/octet-stream");

      verify(embeddingFunction).embed(text.capture());
      assertThat(text.getValue()).isEqualTo("file: blob.bin, size: 4 bytes");
    }

    @Test
    @DisplayName("Should describe an empty file instead of embedding empty text")
    void shouldDescribeEmptyFile() throws IOException {
      Path file = TestFixtures.writeText(tempDir, "empty.txt", "");

      embeddingService.embedFile(file, "text/plain");

      verify(embeddingFunction).embed("file: empty.txt, size: 0 bytes");
    }

    @Test
    @DisplayName("Should describe a whitespace-only file instead of embedding empty text")
    void shouldDescribeWhitespaceOnlyFile() throws IOException {
      Path file = TestFixtures.writeText(tempDir, "blank.txt", " \n\t\n");

      embeddingService.embedFile(file, "text/plain");

      verify(embeddingFunction).embed("file: blank.txt, size: 4 bytes");
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
      assertThatThrownBy(() -> embeddingService.embedFile(tempDir.resolve("nope.txt"), "text/plain"))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("File not found");
    }

    @Test
    @DisplayName("Should fail for an unreadable image")
    void shouldFailForCorruptImage() throws IOException {
      Path file = TestFixtures.writeText(tempDir, "broken.png", "not really a png");

      assertThatThrownBy(() -> embeddingService.embedFile(file, "image/png"))
          .isInstanceOf(EmbeddingException.class)
          .hasCauseInstanceOf(IOException.class);
    }
  }

  @Nested
  @DisplayName("Similarity")
  class Similarity {

    private final List<Float> a = Arrays.asList(1.0f, 2.0f, 3.0f);
    private final List<Float> b = Arrays.asList(3.0f, 1.0f, 0.5f);
    private final List<Float> zero = Arrays.asList(0.0f, 0.0f, 0.0f);

    @Test
    @DisplayName("Should be symmetric")
    void shouldBeSymmetric() {
      assertThat(embeddingService.similarity(a, b)).isEqualTo(embeddingService.similarity(b, a));
    }

    @Test
    @DisplayName("Should be 1 for identical vectors")
    void shouldBeOneForIdenticalVectors() {
      assertThat(embeddingService.similarity(a, a)).isCloseTo(1.0, offset(1e-9));
    }

    @Test
    @DisplayName("Should be 0 when either vector is zero")
    void shouldBeZeroForZeroVector() {
      assertThat(embeddingService.similarity(a, zero)).isZero();
      assertThat(embeddingService.similarity(zero, a)).isZero();
    }

    @Test
    @DisplayName("Should clamp opposite vectors to 0")
    void shouldClampNegativeCosine() {
      List<Float> opposite = Arrays.asList(-1.0f, -2.0f, -3.0f);

      assertThat(embeddingService.similarity(a, opposite)).isZero();
    }

    @Test
    @DisplayName("Should reject vectors of different length")
    void shouldRejectDimensionMismatch() {
      assertThatThrownBy(() -> embeddingService.similarity(a, Arrays.asList(1.0f)))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
