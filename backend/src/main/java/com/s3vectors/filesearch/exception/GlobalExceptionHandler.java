package com.s3vectors.filesearch.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Set<String> IGNORED_PATHS = Set.of("favicon.ico");

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(FileValidationException.class)
  public ResponseEntity<ErrorResponse> handleFileValidationException(
      FileValidationException ex, WebRequest request) {
    log.warn("File rejected ({}): {}", ex.getFailureKind(), ex.getMessage());
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getFailureKind().name(), request);
  }

  @ExceptionHandler(EmbeddingException.class)
  public ResponseEntity<ErrorResponse> handleEmbeddingException(
      EmbeddingException ex, WebRequest request) {
    log.error("Embedding failed: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), null, request);
  }

  @ExceptionHandler(VectorBackendException.class)
  public ResponseEntity<ErrorResponse> handleVectorBackendException(
      VectorBackendException ex, WebRequest request) {
    HttpStatus status =
        ex.getFailureKind() == BackendFailureKind.VALIDATION
                || ex.getFailureKind() == BackendFailureKind.EMPTY_INDEX_VALIDATION
            ? HttpStatus.BAD_REQUEST
            : HttpStatus.BAD_GATEWAY;
    log.error("Vector backend error ({}): {}", ex.getFailureKind(), ex.getMessage());
    return buildErrorResponse(status, ex.getMessage(), ex.getFailureKind().name(), request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    log.error("Invalid argument: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), null, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new HashMap<>();
    ex.getBindingResult()
        .getAllErrors()
        .forEach(
            error -> {
              String fieldName =
                  error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
              errors.put(fieldName, error.getDefaultMessage());
            });

    log.error("Validation failed: {}", errors);

    ErrorResponse errorResponse =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request data")
            .validationErrors(errors)
            .path(extractPath(request))
            .build();

    return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
      ResourceNotFoundException ex, WebRequest request) {
    log.warn("Resource not found: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage(), null, request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNoResourceFound(
      NoResourceFoundException ex, WebRequest request) {
    String path = extractPath(request);
    if (!shouldIgnorePath(path)) {
      log.warn("Not found: {}", path);
    }
    return buildErrorResponse(
        HttpStatus.NOT_FOUND, "The requested resource was not found", null, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("Method not allowed: {}", message);
    return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, message, null, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Bad request: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed JSON request", null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);

    ErrorResponse.ErrorResponseBuilder builder =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
            .message("An unexpected error occurred")
            .path(extractPath(request));

    if (debugEnabled && !"production".equals(environment)) {
      builder.debugMessage(ex.getMessage());
    }

    return new ResponseEntity<>(builder.build(), HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ErrorResponse> buildErrorResponse(
      HttpStatus status, String message, String failureKind, WebRequest request) {
    ErrorResponse errorResponse =
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .failureKind(failureKind)
            .path(extractPath(request))
            .build();

    return new ResponseEntity<>(errorResponse, status);
  }

  private String extractPath(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  private boolean shouldIgnorePath(String path) {
    return IGNORED_PATHS.stream().anyMatch(path::contains);
  }

  /** Error body returned by every endpoint. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Standard error response")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;

    /** Validation or backend failure kind, when the error carries one. */
    private String failureKind;

    private Map<String, String> validationErrors;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
