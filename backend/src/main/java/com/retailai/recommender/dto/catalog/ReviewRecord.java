package com.retailai.recommender.dto.catalog;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A single raw customer review as delivered by the review source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRecord {

  @NotBlank
  @JsonProperty("item_id")
  private String itemId;

  @Min(1)
  @Max(5)
  @JsonProperty("rating")
  private int rating;

  /** Raw sentiment as produced upstream, e.g. "0.8" or "score: -0.4". May be absent. */
  @JsonProperty("sentiment")
  @JsonAlias("sentiment_score")
  private String sentiment;

  @JsonProperty("text")
  private String text;

  @JsonProperty("reviewed_at")
  private Instant reviewedAt;
}
