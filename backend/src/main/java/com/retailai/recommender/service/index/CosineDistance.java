package com.retailai.recommender.service.index;

/**
 * Cosine distance helpers. Distance is {@code 1 - cosine_similarity}, in [0, 2]. A zero vector is
 * at distance 1.0 from everything.
 */
public final class CosineDistance {

  private CosineDistance() {}

  public static double distance(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vectors must have the same dimension: " + a.length + " vs " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 1.0;
    }
    return clamp(1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB)));
  }

  /** Distance between two vectors already scaled to unit length (or zero). */
  static double unitDistance(float[] a, float[] b) {
    double dot = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
    }
    return clamp(1.0 - dot);
  }

  /** Returns a unit-length copy; a zero vector is returned as a zero copy. */
  public static float[] normalize(float[] vector) {
    double norm = 0.0;
    for (float v : vector) {
      norm += v * v;
    }
    float[] result = new float[vector.length];
    if (norm == 0.0) {
      return result;
    }
    double inv = 1.0 / Math.sqrt(norm);
    for (int i = 0; i < vector.length; i++) {
      result[i] = (float) (vector[i] * inv);
    }
    return result;
  }

  private static double clamp(double distance) {
    if (distance < 0.0) {
      return 0.0;
    }
    return Math.min(distance, 2.0);
  }
}
