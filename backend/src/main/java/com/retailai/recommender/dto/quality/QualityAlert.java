package com.retailai.recommender.dto.quality;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Latest classification of an item. Replaced wholesale on every refresh cycle. */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QualityAlert {

  @JsonProperty("item_id")
  String itemId;

  @JsonProperty("risk_level")
  RiskLevel riskLevel;

  @JsonProperty("matched_rule")
  String matchedRule;

  @JsonProperty("evidence")
  QualityEvidence evidence;

  @JsonProperty("explanation")
  String explanation;

  @JsonProperty("generated_at")
  Instant generatedAt;
}
