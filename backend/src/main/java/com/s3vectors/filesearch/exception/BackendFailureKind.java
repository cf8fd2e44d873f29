package com.s3vectors.filesearch.exception;

/** Classification of errors returned by the vector backend. */
public enum BackendFailureKind {
  /** Query vector did not match the index dimension because nothing has been stored yet. */
  EMPTY_INDEX_VALIDATION,
  VALIDATION,
  AUTHORIZATION,
  NOT_FOUND,
  CONNECTIVITY,
  SERVICE;

  public boolean isBenign() {
    return this == EMPTY_INDEX_VALIDATION;
  }
}
