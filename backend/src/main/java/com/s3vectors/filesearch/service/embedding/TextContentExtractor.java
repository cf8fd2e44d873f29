package com.s3vectors.filesearch.service.embedding;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

/** Reads text files as UTF-8, retrying as ISO-8859-1 when the bytes are not valid UTF-8. */
@Slf4j
class TextContentExtractor implements ContentExtractor {

  @Override
  public String extractText(Path file) throws IOException {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (CharacterCodingException e) {
      log.debug("{} is not valid UTF-8, reading as ISO-8859-1", file.getFileName());
      return Files.readString(file, StandardCharsets.ISO_8859_1);
    }
  }
}
