package com.s3vectors.filesearch.exception;

import com.s3vectors.filesearch.service.validation.ValidationFailureKind;

/** Raised when a file is rejected by the validation gate. Never retried. */
public class FileValidationException extends RuntimeException {

  private final ValidationFailureKind failureKind;

  public FileValidationException(ValidationFailureKind failureKind, String message) {
    super(message);
    this.failureKind = failureKind;
  }

  public ValidationFailureKind getFailureKind() {
    return failureKind;
  }
}
