package com.retailai.recommender.service.quality;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.catalog.Item;
import com.retailai.recommender.dto.catalog.ReviewRecord;
import com.retailai.recommender.dto.quality.Classification;
import com.retailai.recommender.dto.quality.QualityAlert;
import com.retailai.recommender.dto.quality.QualityEvidence;
import com.retailai.recommender.dto.quality.RiskLevel;
import com.retailai.recommender.exception.ItemNotFoundException;
import com.retailai.recommender.service.ai.ExplanationContext;
import com.retailai.recommender.service.ai.ExplanationService;
import com.retailai.recommender.service.catalog.CatalogRepository;
import com.retailai.recommender.service.catalog.ReviewRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Regenerates and serves the quality alert feed. */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityAlertService {

  /** Most severe first, then by item id. */
  static final Comparator<QualityAlert> FEED_ORDER =
      Comparator.comparing((QualityAlert a) -> a.getRiskLevel().getSeverity())
          .reversed()
          .thenComparing(QualityAlert::getItemId);

  private final CatalogRepository catalogRepository;
  private final ReviewRepository reviewRepository;
  private final QualityEvidenceCalculator evidenceCalculator;
  private final QualityRiskClassifier riskClassifier;
  private final QualityAlertRepository alertRepository;
  private final ExplanationService explanationService;
  private final ApplicationProperties applicationProperties;
  private final Clock clock;

  /**
   * Recomputes evidence and classification for every catalog item and every reviewed item, then
   * replaces the alert table wholesale.
   *
   * @return number of alerts written
   */
  public int regenerateAll() {
    Map<String, List<ReviewRecord>> reviewsByItem = reviewRepository.findAllGroupedByItem();
    Map<String, Item> itemsById =
        catalogRepository.findAll().stream()
            .collect(Collectors.toMap(Item::getItemId, item -> item, (a, b) -> b));

    Set<String> itemIds = new TreeSet<>(itemsById.keySet());
    itemIds.addAll(reviewsByItem.keySet());

    Instant generatedAt = clock.instant();
    List<QualityAlert> alerts = new ArrayList<>(itemIds.size());
    for (String itemId : itemIds) {
      QualityEvidence evidence =
          evidenceCalculator.compute(itemId, reviewsByItem.getOrDefault(itemId, List.of()));
      Classification classification = riskClassifier.classify(evidence);
      alerts.add(
          QualityAlert.builder()
              .itemId(itemId)
              .riskLevel(classification.getRiskLevel())
              .matchedRule(classification.getMatchedRule())
              .evidence(evidence)
              .generatedAt(generatedAt)
              .build());
    }

    if (applicationProperties.getQuality().isExplanationsEnabled()) {
      alerts = attachExplanations(alerts, itemsById);
    }

    alertRepository.replaceAll(alerts);
    logSummary(alerts);
    return alerts.size();
  }

  private List<QualityAlert> attachExplanations(
      List<QualityAlert> alerts, Map<String, Item> itemsById) {
    List<Integer> positions = new ArrayList<>();
    List<ExplanationContext> contexts = new ArrayList<>();
    for (int i = 0; i < alerts.size(); i++) {
      QualityAlert alert = alerts.get(i);
      if (alert.getRiskLevel() == RiskLevel.OK) {
        continue;
      }
      Item item = itemsById.get(alert.getItemId());
      positions.add(i);
      contexts.add(
          ExplanationContext.builder()
              .kind(ExplanationContext.Kind.QUALITY_ALERT)
              .anchorItemId(alert.getItemId())
              .anchorName(item != null ? item.getName() : null)
              .anchorCategory(item != null ? item.getCategory() : null)
              .riskLevel(alert.getRiskLevel())
              .evidence(alert.getEvidence())
              .build());
    }
    if (contexts.isEmpty()) {
      return alerts;
    }

    List<Optional<String>> explanations =
        explanationService.explainAll(
            contexts, applicationProperties.getRecommendation().getExplanationTimeout());
    List<QualityAlert> result = new ArrayList<>(alerts);
    for (int j = 0; j < positions.size(); j++) {
      int position = positions.get(j);
      Optional<String> explanation = explanations.get(j);
      if (explanation.isPresent()) {
        QualityAlert alert = result.get(position);
        result.set(position, alert.toBuilder().explanation(explanation.get()).build());
      }
    }
    return result;
  }

  /**
   * Current alerts in feed order.
   *
   * @param riskLevel only this tier, or all tiers when null
   * @param actionableOnly only HIGH_RISK and MEDIUM_RISK
   */
  public List<QualityAlert> findAlerts(RiskLevel riskLevel, boolean actionableOnly) {
    return alertRepository.findAll().stream()
        .filter(a -> riskLevel == null || a.getRiskLevel() == riskLevel)
        .filter(a -> !actionableOnly || a.getRiskLevel().isActionable())
        .sorted(FEED_ORDER)
        .collect(Collectors.toList());
  }

  public QualityAlert getAlert(String itemId) {
    return alertRepository
        .findByItemId(itemId)
        .orElseThrow(
            () -> new ItemNotFoundException(itemId, "No quality alert for item: " + itemId));
  }

  /** Classifies ad-hoc evidence without touching the alert table. */
  public Classification classify(QualityEvidence evidence) {
    return riskClassifier.classify(evidence);
  }

  private void logSummary(List<QualityAlert> alerts) {
    Map<RiskLevel, Long> counts = new EnumMap<>(RiskLevel.class);
    for (QualityAlert alert : alerts) {
      counts.merge(alert.getRiskLevel(), 1L, Long::sum);
    }
    log.info("Regenerated {} quality alerts: {}", alerts.size(), counts);
  }
}
