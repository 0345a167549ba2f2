package com.retailai.recommender.dto.embedding;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One version of an item's embedding for a single modality. Instances are never mutated; a
 * refresh supersedes the current version with a new instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Embedding {

  String itemId;

  Modality modality;

  float[] vector;

  int dim;

  Instant createdAt;

  /** Per (item, modality) version counter, starting at 1. */
  long sourceVersion;

  /** Returns a copy so callers cannot alter a stored version. */
  public float[] getVector() {
    return vector == null ? null : vector.clone();
  }

  /** Read-only access for the index and distance code, which never writes to the array. */
  @JsonIgnore
  public float[] vectorView() {
    return vector;
  }
}
