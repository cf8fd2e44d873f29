package com.s3vectors.filesearch.exception;

/** Raised when a call to the vector backend fails. */
public class VectorBackendException extends RuntimeException {

  private final BackendFailureKind failureKind;

  public VectorBackendException(BackendFailureKind failureKind, String message) {
    super(message);
    this.failureKind = failureKind;
  }

  public VectorBackendException(BackendFailureKind failureKind, String message, Throwable cause) {
    super(message, cause);
    this.failureKind = failureKind;
  }

  public BackendFailureKind getFailureKind() {
    return failureKind;
  }

  /** True when the failure is expected validation noise from an index with no vectors. */
  public boolean isEmptyIndexNoise() {
    return failureKind.isBenign();
  }
}
