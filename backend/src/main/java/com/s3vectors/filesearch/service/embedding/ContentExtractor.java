package com.s3vectors.filesearch.service.embedding;

import java.io.IOException;
import java.nio.file.Path;

/** Turns a file of one {@link ContentKind} into the text that gets embedded. */
public interface ContentExtractor {

  String extractText(Path file) throws IOException;
}
