package com.s3vectors.filesearch.service.vector;

/** Result of a delete request. */
public enum DeleteOutcome {
  DELETED,
  /** The deployment cannot delete vectors; nothing was removed. */
  NOT_SUPPORTED,
  NOT_FOUND
}
