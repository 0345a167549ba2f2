package com.retailai.recommender.service.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.retailai.recommender.dto.embedding.Modality;

/**
 * Immutable, queryable version of a modality's vector index.
 *
 * <p>Nothing reachable from a snapshot is ever written after construction. An incremental insert
 * produces a new snapshot that shares every untouched inverted list with its parent, so readers
 * holding the old reference keep a consistent view for as long as they need it.
 */
public final class IndexSnapshot {

  private final long version;
  private final Modality modality;
  private final IndexType indexType;
  private final int dimension;
  private final float[][] centroids;
  private final List<InvertedList> lists;
  private final Map<String, Integer> assignments;
  private final int builtSize;
  private final int insertedSinceBuild;
  private final Instant builtAt;
  private final Instant createdAt;

  IndexSnapshot(
      long version,
      Modality modality,
      IndexType indexType,
      int dimension,
      float[][] centroids,
      List<InvertedList> lists,
      Map<String, Integer> assignments,
      int builtSize,
      int insertedSinceBuild,
      Instant builtAt,
      Instant createdAt) {
    this.version = version;
    this.modality = modality;
    this.indexType = indexType;
    this.dimension = dimension;
    this.centroids = centroids;
    this.lists = Collections.unmodifiableList(lists);
    this.assignments = Collections.unmodifiableMap(assignments);
    this.builtSize = builtSize;
    this.insertedSinceBuild = insertedSinceBuild;
    this.builtAt = builtAt;
    this.createdAt = createdAt;
  }

  /** Placeholder published before the first build. Version 0 marks it as never built. */
  static IndexSnapshot empty(Modality modality, int dimension, Instant now) {
    return new IndexSnapshot(
        0L,
        modality,
        IndexType.IVF,
        dimension,
        new float[0][],
        List.of(),
        Map.of(),
        0,
        0,
        now,
        now);
  }

  /**
   * Returns a copy with the given unit vectors added to their nearest lists. An item that is
   * already indexed is moved, not duplicated.
   */
  IndexSnapshot withInserts(long newVersion, Map<String, float[]> unitVectors, Instant now) {
    float[][] newCentroids = centroids;
    List<InvertedList> newLists = new ArrayList<>(lists);
    Map<String, Integer> newAssignments = new HashMap<>(assignments);

    for (Map.Entry<String, float[]> entry : unitVectors.entrySet()) {
      String itemId = entry.getKey();
      float[] vector = entry.getValue();

      Integer previous = newAssignments.get(itemId);
      if (previous != null) {
        newLists.set(previous, newLists.get(previous).without(itemId));
      }

      if (newCentroids.length == 0) {
        newCentroids = new float[][] {vector};
        newLists.add(InvertedList.EMPTY);
      }
      int target = nearestList(newCentroids, vector);
      newLists.set(target, newLists.get(target).with(itemId, vector));
      newAssignments.put(itemId, target);
    }

    return new IndexSnapshot(
        newVersion,
        modality,
        indexType,
        dimension,
        newCentroids,
        newLists,
        newAssignments,
        builtSize,
        insertedSinceBuild + unitVectors.size(),
        builtAt,
        now);
  }

  static int nearestList(float[][] centroids, float[] unitVector) {
    int best = 0;
    double bestDistance = Double.MAX_VALUE;
    for (int c = 0; c < centroids.length; c++) {
      double d = CosineDistance.unitDistance(centroids[c], unitVector);
      if (d < bestDistance) {
        bestDistance = d;
        best = c;
      }
    }
    return best;
  }

  public long getVersion() {
    return version;
  }

  public Modality getModality() {
    return modality;
  }

  public IndexType getIndexType() {
    return indexType;
  }

  public int getDimension() {
    return dimension;
  }

  public int size() {
    return assignments.size();
  }

  public boolean isEmpty() {
    return assignments.isEmpty();
  }

  public boolean contains(String itemId) {
    return assignments.containsKey(itemId);
  }

  public int numLists() {
    return lists.size();
  }

  /** Number of vectors indexed by the last full build. */
  public int getBuiltSize() {
    return builtSize;
  }

  /** Vectors added incrementally since the last full build. */
  public int getInsertedSinceBuild() {
    return insertedSinceBuild;
  }

  public Instant getBuiltAt() {
    return builtAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isBuilt() {
    return version > 0;
  }

  float[] centroid(int list) {
    return centroids[list];
  }

  InvertedList list(int list) {
    return lists.get(list);
  }
}
