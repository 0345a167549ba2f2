package com.retailai.recommender.service.index;

import java.util.Arrays;
import java.util.Random;

/**
 * Trains the coarse quantizer of an IVF index: k-means on the unit sphere with k-means++ seeding.
 * Deterministic for a given input order and seed.
 */
final class SphericalKMeans {

  /** Upper bound on training points per centroid; larger corpora are sampled. */
  static final int MAX_POINTS_PER_CENTROID = 256;

  private SphericalKMeans() {}

  /**
   * @param points unit-length vectors
   * @param k requested number of centroids; at most {@code points.length} are returned
   * @param iterations maximum Lloyd iterations
   * @param random source of randomness for seeding and sampling
   * @return unit-length centroids
   */
  static float[][] train(float[][] points, int k, int iterations, Random random) {
    int n = points.length;
    if (n == 0) {
      return new float[0][];
    }
    if (n <= k) {
      float[][] centroids = new float[n][];
      for (int i = 0; i < n; i++) {
        centroids[i] = points[i].clone();
      }
      return centroids;
    }

    float[][] sample = sample(points, k * MAX_POINTS_PER_CENTROID, random);
    float[][] centroids = seed(sample, k, random);
    int dim = sample[0].length;
    int[] assignment = new int[sample.length];
    Arrays.fill(assignment, -1);

    for (int iter = 0; iter < iterations; iter++) {
      boolean changed = false;
      double[] distances = new double[sample.length];
      for (int i = 0; i < sample.length; i++) {
        int nearest = IndexSnapshot.nearestList(centroids, sample[i]);
        distances[i] = CosineDistance.unitDistance(centroids[nearest], sample[i]);
        if (nearest != assignment[i]) {
          assignment[i] = nearest;
          changed = true;
        }
      }
      if (!changed) {
        break;
      }

      double[][] sums = new double[k][dim];
      int[] counts = new int[k];
      for (int i = 0; i < sample.length; i++) {
        int c = assignment[i];
        counts[c]++;
        for (int d = 0; d < dim; d++) {
          sums[c][d] += sample[i][d];
        }
      }

      for (int c = 0; c < k; c++) {
        if (counts[c] == 0) {
          // Empty cluster: move it onto the worst-served point
          int farthest = 0;
          for (int i = 1; i < sample.length; i++) {
            if (distances[i] > distances[farthest]) {
              farthest = i;
            }
          }
          centroids[c] = sample[farthest].clone();
          distances[farthest] = 0.0;
          continue;
        }
        float[] mean = new float[dim];
        for (int d = 0; d < dim; d++) {
          mean[d] = (float) sums[c][d];
        }
        centroids[c] = CosineDistance.normalize(mean);
      }
    }
    return centroids;
  }

  private static float[][] sample(float[][] points, int limit, Random random) {
    if (points.length <= limit) {
      return points;
    }
    int[] indices = new int[points.length];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = i;
    }
    for (int i = 0; i < limit; i++) {
      int j = i + random.nextInt(indices.length - i);
      int tmp = indices[i];
      indices[i] = indices[j];
      indices[j] = tmp;
    }
    float[][] sample = new float[limit][];
    for (int i = 0; i < limit; i++) {
      sample[i] = points[indices[i]];
    }
    return sample;
  }

  private static float[][] seed(float[][] points, int k, Random random) {
    float[][] centroids = new float[k][];
    centroids[0] = points[random.nextInt(points.length)].clone();
    double[] nearest = new double[points.length];
    for (int i = 0; i < points.length; i++) {
      nearest[i] = CosineDistance.unitDistance(centroids[0], points[i]);
    }

    for (int c = 1; c < k; c++) {
      double total = 0.0;
      for (double d : nearest) {
        total += d * d;
      }
      int chosen;
      if (total == 0.0) {
        chosen = random.nextInt(points.length);
      } else {
        double target = random.nextDouble() * total;
        chosen = points.length - 1;
        double running = 0.0;
        for (int i = 0; i < points.length; i++) {
          running += nearest[i] * nearest[i];
          if (running >= target) {
            chosen = i;
            break;
          }
        }
      }
      centroids[c] = points[chosen].clone();
      for (int i = 0; i < points.length; i++) {
        nearest[i] = Math.min(nearest[i], CosineDistance.unitDistance(centroids[c], points[i]));
      }
    }
    return centroids;
  }
}
