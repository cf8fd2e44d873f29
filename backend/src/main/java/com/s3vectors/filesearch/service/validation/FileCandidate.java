package com.s3vectors.filesearch.service.validation;

import java.nio.file.Path;

import lombok.Value;

/** A file offered for upload, with the content type the caller declared (may be null). */
@Value
public class FileCandidate {

  Path path;
  String declaredContentType;

  public static FileCandidate of(Path path) {
    return new FileCandidate(path, null);
  }

  public static FileCandidate of(Path path, String declaredContentType) {
    return new FileCandidate(path, declaredContentType);
  }
}
