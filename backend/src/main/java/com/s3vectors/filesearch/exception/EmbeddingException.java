package com.s3vectors.filesearch.exception;

/** Raised when content cannot be turned into an embedding vector. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
