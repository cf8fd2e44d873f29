package com.s3vectors.filesearch.controller;

import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.s3vectors.filesearch.dto.BatchUploadRequest;
import com.s3vectors.filesearch.dto.BatchUploadResponse;
import com.s3vectors.filesearch.dto.DeleteResponse;
import com.s3vectors.filesearch.dto.FileInfoResponse;
import com.s3vectors.filesearch.dto.FileUploadRequest;
import com.s3vectors.filesearch.dto.QueryRequest;
import com.s3vectors.filesearch.dto.QueryResponse;
import com.s3vectors.filesearch.dto.UploadResponse;
import com.s3vectors.filesearch.exception.ResourceNotFoundException;
import com.s3vectors.filesearch.service.vector.DeleteOutcome;
import com.s3vectors.filesearch.service.vector.FileUploadItem;
import com.s3vectors.filesearch.service.vector.QueryResult;
import com.s3vectors.filesearch.service.vector.QuerySpec;
import com.s3vectors.filesearch.service.vector.UploadedFile;
import com.s3vectors.filesearch.service.vector.VectorStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Files", description = "Upload, search and manage file vectors")
public class FileVectorController {

  private final VectorStorageService vectorStorageService;

  @PostMapping(
      value = "/files",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload a file",
      description = "Validate a file, embed its content and store the vector with its metadata")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "File stored",
            content = @Content(schema = @Schema(implementation = UploadResponse.class))),
        @ApiResponse(responseCode = "400", description = "File rejected", content = @Content),
        @ApiResponse(
            responseCode = "422",
            description = "Content could not be embedded",
            content = @Content),
        @ApiResponse(responseCode = "502", description = "Vector backend error", content = @Content)
      })
  public ResponseEntity<UploadResponse> uploadFile(@Valid @RequestBody FileUploadRequest request) {
    log.info("Upload requested for {}", request.getFilePath());
    UploadedFile uploaded =
        vectorStorageService.uploadFile(
            Paths.get(request.getFilePath()), request.getMetadata(), request.getContentType());
    return ResponseEntity.ok(UploadResponse.from(uploaded));
  }

  @PostMapping(
      value = "/files/batch",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload several files",
      description =
          "Upload files in one request. Each file succeeds or fails on its own unless the total size exceeds the batch limit.")
  public ResponseEntity<BatchUploadResponse> uploadBatch(
      @Valid @RequestBody BatchUploadRequest request) {
    List<FileUploadItem> items =
        request.getFiles().stream()
            .map(
                file ->
                    FileUploadItem.builder()
                        .path(Paths.get(file.getFilePath()))
                        .metadata(file.getMetadata())
                        .contentType(file.getContentType())
                        .build())
            .collect(Collectors.toList());
    log.info("Batch upload requested for {} files", items.size());
    return ResponseEntity.ok(BatchUploadResponse.from(vectorStorageService.uploadBatch(items)));
  }

  @PostMapping(
      value = "/query",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Similarity search",
      description = "Find the stored files closest to a query vector or query text")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Matches in descending similarity",
            content = @Content(schema = @Schema(implementation = QueryResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Neither or both of query_vector and query_text given",
            content = @Content)
      })
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    QueryResult result =
        vectorStorageService.query(
            QuerySpec.builder()
                .vector(request.getQueryVector())
                .text(request.getQueryText())
                .topK(request.getTopK())
                .similarityThreshold(request.getSimilarityThreshold())
                .metadataFilter(request.getMetadataFilter())
                .build());
    return ResponseEntity.ok(QueryResponse.from(result));
  }

  @GetMapping(value = "/files", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "List files",
      description =
          "Best-effort listing: returns at most the configured maximum, ordered by similarity to a fixed placeholder vector rather than by upload time")
  public ResponseEntity<List<FileInfoResponse>> listFiles(
      @Parameter(description = "Maximum number of files to return")
          @RequestParam(value = "limit", required = false)
          Integer limit) {
    List<FileInfoResponse> files =
        vectorStorageService.listFiles(limit).stream()
            .map(FileInfoResponse::from)
            .collect(Collectors.toList());
    return ResponseEntity.ok(files);
  }

  @GetMapping(value = "/files/{fileId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Get file information",
      description =
          "Looks the key up among the files a best-effort listing returns, so files beyond the listing cap are not found")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "File found"),
        @ApiResponse(responseCode = "404", description = "File not found", content = @Content)
      })
  public ResponseEntity<FileInfoResponse> getFile(@PathVariable String fileId) {
    return vectorStorageService
        .getFile(fileId)
        .map(FileInfoResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("File", "id", fileId));
  }

  @DeleteMapping(value = "/files/{fileId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Delete a file vector",
      description = "Outcome is DELETED, or NOT_SUPPORTED when the deployment cannot delete vectors")
  public ResponseEntity<DeleteResponse> deleteFile(@PathVariable String fileId) {
    DeleteOutcome outcome = vectorStorageService.deleteFile(fileId);
    if (outcome == DeleteOutcome.NOT_FOUND) {
      throw new ResourceNotFoundException("File", "id", fileId);
    }

    String message =
        outcome == DeleteOutcome.DELETED
            ? "File deleted"
            : "Vector deletion is not supported by this deployment";
    return ResponseEntity.status(HttpStatus.OK)
        .body(DeleteResponse.builder().fileId(fileId).outcome(outcome).message(message).build());
  }
}
