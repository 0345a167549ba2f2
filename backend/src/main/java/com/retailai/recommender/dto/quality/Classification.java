package com.retailai.recommender.dto.quality;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/** Outcome of the risk classifier: the tier and the name of the rule that produced it. */
@Value
public class Classification {

  @JsonProperty("risk_level")
  RiskLevel riskLevel;

  @JsonProperty("matched_rule")
  String matchedRule;
}
