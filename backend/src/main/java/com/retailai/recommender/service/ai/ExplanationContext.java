package com.retailai.recommender.service.ai;

import com.retailai.recommender.dto.quality.QualityEvidence;
import com.retailai.recommender.dto.quality.RiskLevel;

import lombok.Builder;
import lombok.Value;

/** Input to a text generator. Recommendation and quality explanations fill different fields. */
@Value
@Builder
public class ExplanationContext {

  public enum Kind {
    RECOMMENDATION,
    QUALITY_ALERT
  }

  Kind kind;

  String anchorItemId;
  String anchorName;
  String anchorCategory;

  String candidateItemId;
  String candidateName;
  String candidateCategory;
  Double distance;

  RiskLevel riskLevel;
  QualityEvidence evidence;
}
