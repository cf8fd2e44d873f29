package com.s3vectors.filesearch.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.s3vectors.filesearch.dto.ValidationConfigResponse;
import com.s3vectors.filesearch.service.validation.FileValidationService;
import com.s3vectors.filesearch.service.vector.HealthReport;
import com.s3vectors.filesearch.service.vector.VectorStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Service", description = "Health and configuration")
public class ServiceStatusController {

  private final VectorStorageService vectorStorageService;
  private final FileValidationService fileValidationService;

  @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Health check",
      description = "Probes the embedding model and the vector index; 503 when either is down")
  public ResponseEntity<HealthReport> health() {
    HealthReport report = vectorStorageService.healthCheck();
    return ResponseEntity.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(report);
  }

  @GetMapping(value = "/validation-config", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Effective file validation limits")
  public ResponseEntity<ValidationConfigResponse> validationConfig() {
    return ResponseEntity.ok(fileValidationService.describeConfiguration());
  }
}
