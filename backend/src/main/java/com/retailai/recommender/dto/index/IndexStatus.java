package com.retailai.recommender.dto.index;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailai.recommender.dto.embedding.Modality;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexStatus {

  @JsonProperty("modality")
  Modality modality;

  @JsonProperty("snapshot_version")
  long snapshotVersion;

  @JsonProperty("index_type")
  String indexType;

  @JsonProperty("dimension")
  int dimension;

  @JsonProperty("size")
  int size;

  @JsonProperty("num_lists")
  int numLists;

  @JsonProperty("inserted_since_build")
  int insertedSinceBuild;

  @JsonProperty("built_at")
  Instant builtAt;

  @JsonProperty("created_at")
  Instant createdAt;

  @JsonProperty("stale")
  boolean stale;
}
