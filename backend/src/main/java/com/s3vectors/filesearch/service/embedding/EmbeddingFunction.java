package com.s3vectors.filesearch.service.embedding;

import java.util.List;

/** Black-box text embedding model producing vectors of a fixed dimension. */
public interface EmbeddingFunction {

  List<Float> embed(String text);

  /** Identifier recorded with every stored vector. */
  String modelId();
}
