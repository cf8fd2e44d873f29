package com.s3vectors.filesearch.service.validation;

/** Reasons a file, or a whole batch, is rejected before any embedding work. */
public enum ValidationFailureKind {
  NOT_FOUND,
  INVALID_PATH,
  EMPTY,
  SIZE_EXCEEDED,
  BLOCKED_EXTENSION,
  DISALLOWED_TYPE,
  BATCH_TOO_LARGE
}
