package com.s3vectors.filesearch.service.vector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Deterministic unit vector used where the backend needs a query vector but the caller has none
 * (listing, lookup by key, health probes).
 */
final class PlaceholderVector {

  private PlaceholderVector() {}

  static List<Float> create(int dimension, long seed) {
    Random random = new Random(seed);
    double[] values = new double[dimension];
    double magnitude = 0.0;
    for (int i = 0; i < dimension; i++) {
      values[i] = random.nextGaussian() * 0.1;
      magnitude += values[i] * values[i];
    }
    magnitude = Math.sqrt(magnitude);

    List<Float> vector = new ArrayList<>(dimension);
    for (double value : values) {
      vector.add((float) (magnitude > 0 ? value / magnitude : value));
    }
    return Collections.unmodifiableList(vector);
  }
}
