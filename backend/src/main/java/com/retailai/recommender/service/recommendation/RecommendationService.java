package com.retailai.recommender.service.recommendation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.catalog.Item;
import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.recommendation.Recommendation;
import com.retailai.recommender.dto.recommendation.RecommendationResponse;
import com.retailai.recommender.exception.InvalidConfigException;
import com.retailai.recommender.service.ai.ExplanationContext;
import com.retailai.recommender.service.ai.ExplanationService;
import com.retailai.recommender.service.catalog.CatalogRepository;
import com.retailai.recommender.service.embedding.EmbeddingStore;
import com.retailai.recommender.service.index.IndexManager;
import com.retailai.recommender.service.index.IndexSnapshot;
import com.retailai.recommender.service.index.Neighbor;
import com.retailai.recommender.service.index.VectorIndexService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers "similar items" queries. Read-only: every query pins one snapshot and never writes to
 * the store or the index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

  private final EmbeddingStore embeddingStore;
  private final IndexManager indexManager;
  private final VectorIndexService vectorIndexService;
  private final CatalogRepository catalogRepository;
  private final ExplanationService explanationService;
  private final ApplicationProperties applicationProperties;

  public RecommendationResponse getRecommendations(String itemId, int k) {
    ApplicationProperties.Recommendation config = applicationProperties.getRecommendation();
    return getRecommendations(
        itemId, k, config.getDefaultModality(), config.isExplanationsEnabled());
  }

  /**
   * Nearest items to the anchor, excluding the anchor itself.
   *
   * @param itemId anchor item
   * @param k maximum number of results, in [1, max-k]
   * @param modality which embedding and index to use
   * @param explain whether to ask the text generator for explanations
   * @return at most {@code k} results sorted by distance then item id; possibly fewer when the
   *     distance threshold removes candidates
   * @throws com.retailai.recommender.exception.ItemNotFoundException if the anchor has no
   *     embedding for the modality
   * @throws InvalidConfigException if {@code k} is out of range
   */
  public RecommendationResponse getRecommendations(
      String itemId, int k, Modality modality, boolean explain) {
    ApplicationProperties.Recommendation config = applicationProperties.getRecommendation();
    if (k <= 0) {
      throw new InvalidConfigException("k must be positive, got " + k);
    }
    if (k > config.getMaxK()) {
      throw new InvalidConfigException("k must not exceed " + config.getMaxK() + ", got " + k);
    }

    IndexSnapshot snapshot = indexManager.current(modality);
    Embedding anchor = embeddingStore.get(itemId, modality);

    boolean stale = indexManager.isStale(snapshot);
    if (stale) {
      log.warn(
          "Serving {} recommendations for {} from stale index v{} created at {}",
          modality,
          itemId,
          snapshot.getVersion(),
          snapshot.getCreatedAt());
    }

    List<Neighbor> neighbors = vectorIndexService.query(snapshot, anchor.vectorView(), k + 1);
    Double threshold = config.getDistanceThreshold();
    List<Neighbor> selected =
        neighbors.stream()
            .filter(n -> !n.getItemId().equals(itemId))
            .limit(k)
            .filter(n -> threshold == null || n.getDistance() <= threshold)
            .collect(Collectors.toList());

    List<Recommendation> recommendations = new ArrayList<>(selected.size());
    for (int i = 0; i < selected.size(); i++) {
      Neighbor neighbor = selected.get(i);
      Recommendation.RecommendationBuilder builder =
          Recommendation.builder()
              .itemId(neighbor.getItemId())
              .distance(neighbor.getDistance())
              .similarity(1.0 - neighbor.getDistance())
              .rank(i + 1);
      catalogRepository
          .findById(neighbor.getItemId())
          .ifPresent(
              item ->
                  builder
                      .name(item.getName())
                      .category(item.getCategory())
                      .price(item.getPrice())
                      .description(item.getDescription()));
      recommendations.add(builder.build());
    }

    if (explain && !recommendations.isEmpty()) {
      recommendations = attachExplanations(itemId, recommendations);
    }

    log.debug(
        "Recommendations for {} ({}, k={}, index v{}): {}",
        itemId,
        modality,
        k,
        snapshot.getVersion(),
        recommendations.size());

    return RecommendationResponse.builder()
        .anchorItemId(itemId)
        .modality(modality)
        .k(k)
        .snapshotVersion(snapshot.getVersion())
        .stale(stale)
        .recommendations(recommendations)
        .build();
  }

  private List<Recommendation> attachExplanations(
      String anchorItemId, List<Recommendation> recommendations) {
    Optional<Item> anchorItem = catalogRepository.findById(anchorItemId);
    List<ExplanationContext> contexts = new ArrayList<>(recommendations.size());
    for (Recommendation recommendation : recommendations) {
      contexts.add(
          ExplanationContext.builder()
              .kind(ExplanationContext.Kind.RECOMMENDATION)
              .anchorItemId(anchorItemId)
              .anchorName(anchorItem.map(Item::getName).orElse(null))
              .anchorCategory(anchorItem.map(Item::getCategory).orElse(null))
              .candidateItemId(recommendation.getItemId())
              .candidateName(recommendation.getName())
              .candidateCategory(recommendation.getCategory())
              .distance(recommendation.getDistance())
              .build());
    }

    List<Optional<String>> explanations =
        explanationService.explainAll(
            contexts, applicationProperties.getRecommendation().getExplanationTimeout());
    List<Recommendation> result = new ArrayList<>(recommendations.size());
    for (int i = 0; i < recommendations.size(); i++) {
      Recommendation recommendation = recommendations.get(i);
      result.add(
          explanations
              .get(i)
              .map(text -> recommendation.toBuilder().explanation(text).build())
              .orElse(recommendation));
    }
    return result;
  }
}
