package com.retailai.recommender.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.retailai.recommender.exception.InvalidConfigException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rejects inconsistent engine settings at startup. A failure here stops the application context,
 * which is the only place a configuration error is allowed to be fatal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineConfigValidator {

  private final ApplicationProperties properties;

  @PostConstruct
  public void validateStartup() {
    List<String> problems = validate(properties);
    if (!problems.isEmpty()) {
      problems.forEach(problem -> log.error("Invalid engine configuration: {}", problem));
      throw new InvalidConfigException(
          "Invalid engine configuration: " + String.join("; ", problems));
    }
    log.info(
        "Engine configuration accepted: textDim={}, imageDim={}, numLists={}, numProbes={}",
        properties.getEmbedding().getTextDimension(),
        properties.getEmbedding().getImageDimension(),
        properties.getIndex().getNumLists(),
        properties.getIndex().getNumProbes());
  }

  static List<String> validate(ApplicationProperties properties) {
    List<String> problems = new ArrayList<>();
    ApplicationProperties.Embedding embedding = properties.getEmbedding();
    ApplicationProperties.Index index = properties.getIndex();
    ApplicationProperties.Recommendation recommendation = properties.getRecommendation();
    ApplicationProperties.Quality quality = properties.getQuality();
    ApplicationProperties.Refresh refresh = properties.getRefresh();
    ApplicationProperties.Retry retry = properties.getRetry();

    if (embedding.getTextDimension() <= 0) {
      problems.add("engine.embedding.text-dimension must be positive");
    }
    if (embedding.getImageDimension() <= 0) {
      problems.add("engine.embedding.image-dimension must be positive");
    }
    if (embedding.getRetentionVersions() < 0) {
      problems.add("engine.embedding.retention-versions must not be negative");
    }
    if (index.getNumLists() < 1) {
      problems.add("engine.index.num-lists must be at least 1");
    }
    if (index.getNumProbes() < 1 || index.getNumProbes() > index.getNumLists()) {
      problems.add("engine.index.num-probes must be between 1 and num-lists");
    }
    if (index.getKmeansIterations() < 1) {
      problems.add("engine.index.kmeans-iterations must be at least 1");
    }
    if (index.getMaxInsertFraction() <= 0.0 || index.getMaxInsertFraction() > 1.0) {
      problems.add("engine.index.max-insert-fraction must be in (0, 1]");
    }
    if (index.getRecallTarget() <= 0.0 || index.getRecallTarget() > 1.0) {
      problems.add("engine.index.recall-target must be in (0, 1]");
    }
    if (recommendation.getDefaultK() < 1
        || recommendation.getDefaultK() > recommendation.getMaxK()) {
      problems.add("engine.recommendation.default-k must be between 1 and max-k");
    }
    if (recommendation.getDistanceThreshold() != null
        && (recommendation.getDistanceThreshold() < 0.0
            || recommendation.getDistanceThreshold() > 2.0)) {
      problems.add("engine.recommendation.distance-threshold must be within [0, 2]");
    }
    if (quality.getNegativeMaxRating() >= quality.getPositiveMinRating()) {
      problems.add("engine.quality.negative-max-rating must be below positive-min-rating");
    }
    if (refresh.getWorkerThreads() < 1) {
      problems.add("engine.refresh.worker-threads must be at least 1");
    }
    if (refresh.getModalities() == null || refresh.getModalities().isEmpty()) {
      problems.add("engine.refresh.modalities must name at least one modality");
    }
    if (retry.getMaxAttempts() < 1) {
      problems.add("engine.retry.max-attempts must be at least 1");
    }
    if (retry.getMultiplier() < 1.0) {
      problems.add("engine.retry.multiplier must be at least 1.0");
    }
    return problems;
  }
}
