package com.s3vectors.filesearch.fixtures;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.s3vectors.filesearch.config.VectorServiceProperties;

/** Shared configuration and file helpers for unit and integration tests. */
public final class TestFixtures {

  public static final int TEST_DIMENSION = 64;
  public static final long MB = 1024L * 1024L;

  private TestFixtures() {}

  /** Default properties with the in-memory backend and a small vector dimension. */
  public static VectorServiceProperties defaultProperties() {
    VectorServiceProperties properties = new VectorServiceProperties();
    properties.getAws().setVectorBucketName("test-bucket");
    properties.getAws().setVectorIndexName("test-index");
    properties.getBackend().setType(VectorServiceProperties.BackendType.MEMORY);
    properties.getVector().setDimension(TEST_DIMENSION);
    return properties;
  }

  public static Path writeText(Path dir, String name, String content) throws IOException {
    return Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
  }

  /** Create a sparse file of the given size without writing its content. */
  public static Path sparseFile(Path dir, String name, long size) throws IOException {
    Path file = dir.resolve(name);
    try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
      raf.setLength(size);
    }
    return file;
  }

  public static List<Float> unitVector(int dimension, int hotIndex) {
    List<Float> vector = new ArrayList<>(dimension);
    for (int i = 0; i < dimension; i++) {
      vector.add(i == hotIndex ? 1.0f : 0.0f);
    }
    return vector;
  }
}
