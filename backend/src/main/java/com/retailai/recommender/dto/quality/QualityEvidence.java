package com.retailai.recommender.dto.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Review signals for one item. Rederived from raw reviews on every refresh, so a classification
 * can always be reproduced from the evidence alone.
 */
@Value
@Builder
@Jacksonized
public class QualityEvidence {

  @JsonProperty("item_id")
  String itemId;

  @Min(0)
  @JsonProperty("positive_reviews")
  int positiveReviews;

  @Min(0)
  @JsonProperty("negative_reviews")
  int negativeReviews;

  @DecimalMin("0.0")
  @DecimalMax("5.0")
  @JsonProperty("avg_rating")
  double avgRating;

  @Min(0)
  @JsonProperty("total_reviews")
  int totalReviews;
}
