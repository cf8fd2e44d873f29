package com.s3vectors.filesearch.service.embedding;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

/**
 * Fallback for unknown content: the file's UTF-8 text when it has one, otherwise a short
 * description built from its name and size.
 */
@Slf4j
class GenericContentExtractor implements ContentExtractor {

  @Override
  public String extractText(Path file) throws IOException {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (CharacterCodingException e) {
      log.debug("{} is binary, embedding a description instead", file.getFileName());
      return describe(file);
    }
  }

  static String describe(Path file) throws IOException {
    return String.format("file: %s, size: %d bytes", file.getFileName(), Files.size(file));
  }
}
