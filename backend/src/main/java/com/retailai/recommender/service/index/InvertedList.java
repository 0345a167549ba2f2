package com.retailai.recommender.service.index;

import java.util.Arrays;

/**
 * One coarse partition of an index: parallel arrays of item ids and unit-length vectors. Never
 * modified after construction; the {@code with}/{@code without} methods return copies.
 */
final class InvertedList {

  static final InvertedList EMPTY = new InvertedList(new String[0], new float[0][]);

  private final String[] ids;
  private final float[][] vectors;

  InvertedList(String[] ids, float[][] vectors) {
    this.ids = ids;
    this.vectors = vectors;
  }

  int size() {
    return ids.length;
  }

  String idAt(int position) {
    return ids[position];
  }

  float[] vectorAt(int position) {
    return vectors[position];
  }

  InvertedList with(String itemId, float[] unitVector) {
    String[] newIds = Arrays.copyOf(ids, ids.length + 1);
    float[][] newVectors = Arrays.copyOf(vectors, vectors.length + 1);
    newIds[ids.length] = itemId;
    newVectors[vectors.length] = unitVector;
    return new InvertedList(newIds, newVectors);
  }

  InvertedList without(String itemId) {
    int position = -1;
    for (int i = 0; i < ids.length; i++) {
      if (ids[i].equals(itemId)) {
        position = i;
        break;
      }
    }
    if (position < 0) {
      return this;
    }
    String[] newIds = new String[ids.length - 1];
    float[][] newVectors = new float[vectors.length - 1][];
    System.arraycopy(ids, 0, newIds, 0, position);
    System.arraycopy(ids, position + 1, newIds, position, ids.length - position - 1);
    System.arraycopy(vectors, 0, newVectors, 0, position);
    System.arraycopy(vectors, position + 1, newVectors, position, vectors.length - position - 1);
    return new InvertedList(newIds, newVectors);
  }
}
