package com.retailai.recommender.dto.recommendation;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailai.recommender.dto.embedding.Modality;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecommendationResponse {

  @JsonProperty("anchor_item_id")
  String anchorItemId;

  @JsonProperty("modality")
  Modality modality;

  @JsonProperty("k")
  int k;

  @JsonProperty("snapshot_version")
  long snapshotVersion;

  /** True when the snapshot that answered the query is older than the configured age. */
  @JsonProperty("stale")
  boolean stale;

  @JsonProperty("recommendations")
  List<Recommendation> recommendations;
}
