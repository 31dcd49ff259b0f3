package com.flamingo.ai.memoryengine.util;

/** Vector helpers for normalized embeddings. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Dot product of two vectors of equal length. For L2-normalized vectors this is the cosine
   * similarity.
   */
  public static double dot(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }

  /** Returns a unit-length copy; a zero vector is returned unchanged. */
  public static float[] normalize(float[] vector) {
    double norm = 0.0;
    for (float v : vector) {
      norm += (double) v * v;
    }
    norm = Math.sqrt(norm);
    float[] result = new float[vector.length];
    if (norm == 0.0) {
      System.arraycopy(vector, 0, result, 0, vector.length);
      return result;
    }
    for (int i = 0; i < vector.length; i++) {
      result[i] = (float) (vector[i] / norm);
    }
    return result;
  }

  /** Highest dot product between {@code query} and any of {@code references}. */
  public static double maxDot(float[] query, float[][] references) {
    double max = Double.NEGATIVE_INFINITY;
    for (float[] reference : references) {
      max = Math.max(max, dot(query, reference));
    }
    return max;
  }
}
