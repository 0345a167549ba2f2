package com.retailai.recommender.service.index;

public enum IndexType {
  /** Inverted-file index: vectors partitioned into coarse lists, only the nearest lists probed. */
  IVF,
  /** Single list scanned exhaustively. Exact, used for small corpora and as ground truth. */
  FLAT
}
