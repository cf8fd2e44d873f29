package com.s3vectors.filesearch.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.s3vectors.filesearch.exception.BackendFailureKind;
import com.s3vectors.filesearch.exception.VectorBackendException;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.document.Document;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3vectors.S3VectorsClient;
import software.amazon.awssdk.services.s3vectors.model.AccessDeniedException;
import software.amazon.awssdk.services.s3vectors.model.DeleteVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.GetOutputVector;
import software.amazon.awssdk.services.s3vectors.model.GetVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.GetVectorsResponse;
import software.amazon.awssdk.services.s3vectors.model.NotFoundException;
import software.amazon.awssdk.services.s3vectors.model.PutVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.QueryOutputVector;
import software.amazon.awssdk.services.s3vectors.model.QueryVectorsRequest;
import software.amazon.awssdk.services.s3vectors.model.QueryVectorsResponse;
import software.amazon.awssdk.services.s3vectors.model.S3VectorsException;
import software.amazon.awssdk.services.s3vectors.model.ValidationException;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3VectorsIndexBackend Tests")
class S3VectorsIndexBackendTest {

  private static final String BUCKET = "my-vector-bucket";
  private static final String INDEX = "file-index";

  @Mock private S3VectorsClient s3VectorsClient;

  private S3VectorsIndexBackend backend;

  @BeforeEach
  void setUp() {
    backend = new S3VectorsIndexBackend(s3VectorsClient, BUCKET, INDEX, true);
  }

  @Test
  @DisplayName("Should require a bucket name")
  void shouldRequireBucketName() {
    assertThatThrownBy(() -> new S3VectorsIndexBackend(s3VectorsClient, " ", INDEX, true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Nested
  @DisplayName("Put Vectors")
  class PutVectors {

    @Test
    @DisplayName("Should send all records in one request with string metadata")
    void shouldPutAllRecords() {
      Map<String, String> metadata = new LinkedHashMap<>();
      metadata.put("file_name", "a.txt");
      metadata.put("file_size", "12");

      backend.putVectors(
          Arrays.asList(
              VectorRecord.builder()
                  .key("k1")
                  .vector(Arrays.asList(0.1f, 0.2f))
                  .metadata(metadata)
                  .build(),
              VectorRecord.builder()
                  .key("k2")
                  .vector(Arrays.asList(0.3f, 0.4f))
                  .metadata(Collections.emptyMap())
                  .build()));

      ArgumentCaptor<PutVectorsRequest> captor = ArgumentCaptor.forClass(PutVectorsRequest.class);
      verify(s3VectorsClient).putVectors(captor.capture());
      PutVectorsRequest request = captor.getValue();
      assertThat(request.vectorBucketName()).isEqualTo(BUCKET);
      assertThat(request.indexName()).isEqualTo(INDEX);
      assertThat(request.vectors()).hasSize(2);
      assertThat(request.vectors().get(0).key()).isEqualTo("k1");
      assertThat(request.vectors().get(0).data().float32()).containsExactly(0.1f, 0.2f);
      assertThat(request.vectors().get(0).metadata().asMap().get("file_size").asString())
          .isEqualTo("12");
    }

    @Test
    @DisplayName("Should translate access denied into an authorization failure")
    void shouldTranslateAccessDenied() {
      when(s3VectorsClient.putVectors(any(PutVectorsRequest.class)))
          .thenThrow(AccessDeniedException.builder().message("not allowed").build());

      assertThatThrownBy(() -> backend.putVectors(Collections.emptyList()))
          .isInstanceOf(VectorBackendException.class)
          .extracting("failureKind")
          .isEqualTo(BackendFailureKind.AUTHORIZATION);
    }
  }

  @Nested
  @DisplayName("Query Vectors")
  class QueryVectors {

    @Test
    @DisplayName("Should request distances and metadata and map the hits")
    void shouldQueryWithDistanceAndMetadata() {
      Map<String, Document> metadata = new LinkedHashMap<>();
      metadata.put("file_name", Document.fromString("a.txt"));
      metadata.put("pages", Document.fromNumber(3));
      when(s3VectorsClient.queryVectors(any(QueryVectorsRequest.class)))
          .thenReturn(
              QueryVectorsResponse.builder()
                  .vectors(
                      QueryOutputVector.builder()
                          .key("k1")
                          .distance(0.25f)
                          .metadata(Document.fromMap(metadata))
                          .build(),
                      QueryOutputVector.builder().key("k2").build())
                  .build());

      List<VectorMatch> matches = backend.queryVectors(Arrays.asList(0.1f, 0.2f), 5, null);

      ArgumentCaptor<QueryVectorsRequest> captor =
          ArgumentCaptor.forClass(QueryVectorsRequest.class);
      verify(s3VectorsClient).queryVectors(captor.capture());
      QueryVectorsRequest request = captor.getValue();
      assertThat(request.topK()).isEqualTo(5);
      assertThat(request.returnDistance()).isTrue();
      assertThat(request.returnMetadata()).isTrue();
      assertThat(request.filter()).isNull();

      assertThat(matches).hasSize(2);
      assertThat(matches.get(0).getKey()).isEqualTo("k1");
      assertThat(matches.get(0).getDistance()).isEqualTo(0.25);
      assertThat(matches.get(0).getMetadata())
          .containsEntry("file_name", "a.txt")
          .containsEntry("pages", "3");
      assertThat(matches.get(1).getMetadata()).isEmpty();
    }

    @Test
    @DisplayName("Should pass the metadata filter through as a document")
    void shouldPassFilter() {
      when(s3VectorsClient.queryVectors(any(QueryVectorsRequest.class)))
          .thenReturn(QueryVectorsResponse.builder().vectors(Collections.emptyList()).build());

      backend.queryVectors(Arrays.asList(0.1f), 3, Map.of("content_type", "text/plain"));

      ArgumentCaptor<QueryVectorsRequest> captor =
          ArgumentCaptor.forClass(QueryVectorsRequest.class);
      verify(s3VectorsClient).queryVectors(captor.capture());
      assertThat(captor.getValue().filter().asMap().get("content_type").asString())
          .isEqualTo("text/plain");
    }

    @Test
    @DisplayName("Should send numeric and boolean filter values as strings like stored metadata")
    void shouldStringifyScalarFilterValues() {
      when(s3VectorsClient.queryVectors(any(QueryVectorsRequest.class)))
          .thenReturn(QueryVectorsResponse.builder().vectors(Collections.emptyList()).build());
      Map<String, Object> filter = new LinkedHashMap<>();
      filter.put("file_size", 11);
      filter.put("reviewed", true);

      backend.queryVectors(Arrays.asList(0.1f), 3, filter);

      ArgumentCaptor<QueryVectorsRequest> captor =
          ArgumentCaptor.forClass(QueryVectorsRequest.class);
      verify(s3VectorsClient).queryVectors(captor.capture());
      Map<String, Document> sent = captor.getValue().filter().asMap();
      assertThat(sent.get("file_size").isString()).isTrue();
      assertThat(sent.get("file_size").asString()).isEqualTo("11");
      assertThat(sent.get("reviewed").asString()).isEqualTo("true");
    }

    @Test
    @DisplayName("Should classify a dimension validation error as empty-index noise")
    void shouldClassifyEmptyIndexError() {
      when(s3VectorsClient.queryVectors(any(QueryVectorsRequest.class)))
          .thenThrow(
              ValidationException.builder()
                  .message("Query vector dimension does not match index dimension")
                  .build());

      assertThatThrownBy(() -> backend.queryVectors(Arrays.asList(0.1f), 1, null))
          .isInstanceOfSatisfying(
              VectorBackendException.class,
              e -> {
                assertThat(e.getFailureKind()).isEqualTo(BackendFailureKind.EMPTY_INDEX_VALIDATION);
                assertThat(e.isEmptyIndexNoise()).isTrue();
              });
    }
  }

  @Nested
  @DisplayName("Error Translation")
  class ErrorTranslation {

    @Test
    @DisplayName("Should keep other validation errors as VALIDATION")
    void shouldKeepValidation() {
      VectorBackendException e =
          S3VectorsIndexBackend.translate(
              "put", ValidationException.builder().message("Invalid key").build());

      assertThat(e.getFailureKind()).isEqualTo(BackendFailureKind.VALIDATION);
      assertThat(e.isEmptyIndexNoise()).isFalse();
    }

    @Test
    @DisplayName("Should map missing resources to NOT_FOUND")
    void shouldMapNotFound() {
      assertThat(
              S3VectorsIndexBackend.translate(
                      "query", NotFoundException.builder().message("no such index").build())
                  .getFailureKind())
          .isEqualTo(BackendFailureKind.NOT_FOUND);
    }

    @Test
    @DisplayName("Should map HTTP 403 to AUTHORIZATION")
    void shouldMapForbiddenStatus() {
      AwsServiceException forbidden =
          S3VectorsException.builder().statusCode(403).message("Forbidden").build();

      assertThat(S3VectorsIndexBackend.translate("query", forbidden).getFailureKind())
          .isEqualTo(BackendFailureKind.AUTHORIZATION);
    }

    @Test
    @DisplayName("Should map client-side failures to CONNECTIVITY")
    void shouldMapClientFailures() {
      assertThat(
              S3VectorsIndexBackend.translate(
                      "query", SdkClientException.create("Unable to execute HTTP request"))
                  .getFailureKind())
          .isEqualTo(BackendFailureKind.CONNECTIVITY);
    }

    @Test
    @DisplayName("Should map other service errors to SERVICE")
    void shouldMapServiceErrors() {
      AwsServiceException internal =
          S3VectorsException.builder().statusCode(500).message("Internal").build();

      assertThat(S3VectorsIndexBackend.translate("query", internal).getFailureKind())
          .isEqualTo(BackendFailureKind.SERVICE);
    }
  }

  @Nested
  @DisplayName("Delete Vector")
  class DeleteVector {

    @Test
    @DisplayName("Should delete an existing vector")
    void shouldDeleteExisting() {
      when(s3VectorsClient.getVectors(any(GetVectorsRequest.class)))
          .thenReturn(
              GetVectorsResponse.builder()
                  .vectors(GetOutputVector.builder().key("k1").build())
                  .build());

      assertThat(backend.deleteVector("k1")).isEqualTo(DeleteOutcome.DELETED);

      ArgumentCaptor<DeleteVectorsRequest> captor =
          ArgumentCaptor.forClass(DeleteVectorsRequest.class);
      verify(s3VectorsClient).deleteVectors(captor.capture());
      assertThat(captor.getValue().keys()).containsExactly("k1");
    }

    @Test
    @DisplayName("Should report NOT_FOUND without deleting an unknown key")
    void shouldReportNotFound() {
      when(s3VectorsClient.getVectors(any(GetVectorsRequest.class)))
          .thenReturn(GetVectorsResponse.builder().vectors(Collections.emptyList()).build());

      assertThat(backend.deleteVector("missing")).isEqualTo(DeleteOutcome.NOT_FOUND);
      verify(s3VectorsClient, never()).deleteVectors(any(DeleteVectorsRequest.class));
    }

    @Test
    @DisplayName("Should report NOT_SUPPORTED when deletion is disabled")
    void shouldReportNotSupported() {
      S3VectorsIndexBackend readOnly =
          new S3VectorsIndexBackend(s3VectorsClient, BUCKET, INDEX, false);

      assertThat(readOnly.deleteVector("k1")).isEqualTo(DeleteOutcome.NOT_SUPPORTED);
      verifyNoInteractions(s3VectorsClient);
    }
  }
}
