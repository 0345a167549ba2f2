package com.retailai.recommender.service.quality;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.quality.Classification;
import com.retailai.recommender.dto.quality.QualityEvidence;
import com.retailai.recommender.dto.quality.RiskLevel;

/**
 * Ordered decision list over review evidence. The first matching rule wins, so the order of
 * {@link #rules} must not change: the broader MONITOR rule would otherwise shadow the risk tiers.
 */
@Component
public class QualityRiskClassifier {

  static final String RULE_HIGH_RISK = "negative-majority-low-rating";
  static final String RULE_MEDIUM_RISK = "many-negative-below-medium-rating";
  static final String RULE_MONITOR = "some-negative-below-monitor-rating";
  static final String RULE_DEFAULT = "default";

  private final List<Rule> rules;

  public QualityRiskClassifier(ApplicationProperties applicationProperties) {
    ApplicationProperties.Quality q = applicationProperties.getQuality();
    double highRiskMaxRating = q.getHighRiskMaxRating();
    int mediumRiskMinNegative = q.getMediumRiskMinNegative();
    double mediumRiskMaxRating = q.getMediumRiskMaxRating();
    double monitorMaxRating = q.getMonitorMaxRating();

    this.rules =
        List.of(
            new Rule(
                RULE_HIGH_RISK,
                RiskLevel.HIGH_RISK,
                e ->
                    e.getNegativeReviews() > e.getPositiveReviews()
                        && e.getAvgRating() < highRiskMaxRating),
            new Rule(
                RULE_MEDIUM_RISK,
                RiskLevel.MEDIUM_RISK,
                e ->
                    e.getNegativeReviews() > mediumRiskMinNegative
                        && e.getAvgRating() < mediumRiskMaxRating),
            new Rule(
                RULE_MONITOR,
                RiskLevel.MONITOR,
                e -> e.getAvgRating() < monitorMaxRating && e.getNegativeReviews() > 0),
            new Rule(RULE_DEFAULT, RiskLevel.OK, e -> true));
  }

  /** Pure and total: the same evidence always yields the same classification. */
  public Classification classify(QualityEvidence evidence) {
    for (Rule rule : rules) {
      if (rule.condition.test(evidence)) {
        return new Classification(rule.level, rule.name);
      }
    }
    throw new IllegalStateException("Default rule did not match");
  }

  /** Rule names in evaluation order. */
  public List<String> ruleNames() {
    return rules.stream().map(r -> r.name).collect(Collectors.toList());
  }

  private static final class Rule {
    private final String name;
    private final RiskLevel level;
    private final Predicate<QualityEvidence> condition;

    private Rule(String name, RiskLevel level, Predicate<QualityEvidence> condition) {
      this.name = name;
      this.level = level;
      this.condition = condition;
    }
  }
}
