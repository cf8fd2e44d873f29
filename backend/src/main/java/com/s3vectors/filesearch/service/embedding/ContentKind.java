package com.s3vectors.filesearch.service.embedding;

import java.util.Locale;

/** Closed set of content families the embedding pipeline knows how to read. */
public enum ContentKind {
  TEXT,
  IMAGE,
  PDF,
  GENERIC;

  public static ContentKind fromContentType(String contentType) {
    if (contentType == null) {
      return GENERIC;
    }
    String normalized = contentType.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith("text/")) {
      return TEXT;
    }
    if (normalized.startsWith("image/")) {
      return IMAGE;
    }
    if (normalized.equals("application/pdf")) {
      return PDF;
    }
    return GENERIC;
  }
}
