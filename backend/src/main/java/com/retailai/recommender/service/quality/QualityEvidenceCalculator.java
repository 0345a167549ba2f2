package com.retailai.recommender.service.quality;

import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.catalog.ReviewRecord;
import com.retailai.recommender.dto.quality.QualityEvidence;

import lombok.RequiredArgsConstructor;

/** Aggregates raw reviews into {@link QualityEvidence}. */
@Component
@RequiredArgsConstructor
public class QualityEvidenceCalculator {

  private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)");

  private final ApplicationProperties applicationProperties;

  /**
   * A review with a parseable sentiment is classified by its sign; otherwise the rating decides.
   * Reviews that are neither positive nor negative still count towards the total and average.
   */
  public QualityEvidence compute(String itemId, List<ReviewRecord> reviews) {
    int positiveMinRating = applicationProperties.getQuality().getPositiveMinRating();
    int negativeMaxRating = applicationProperties.getQuality().getNegativeMaxRating();

    int positive = 0;
    int negative = 0;
    long ratingSum = 0;
    for (ReviewRecord review : reviews) {
      ratingSum += review.getRating();
      OptionalDouble sentiment = parseSentiment(review.getSentiment());
      if (sentiment.isPresent()) {
        if (sentiment.getAsDouble() > 0) {
          positive++;
        } else if (sentiment.getAsDouble() < 0) {
          negative++;
        }
      } else if (review.getRating() >= positiveMinRating) {
        positive++;
      } else if (review.getRating() <= negativeMaxRating) {
        negative++;
      }
    }

    double avgRating = reviews.isEmpty() ? 0.0 : (double) ratingSum / reviews.size();
    return QualityEvidence.builder()
        .itemId(itemId)
        .positiveReviews(positive)
        .negativeReviews(negative)
        .avgRating(avgRating)
        .totalReviews(reviews.size())
        .build();
  }

  /** First numeric token of a raw sentiment value, e.g. {@code "score: -0.4"} gives -0.4. */
  static OptionalDouble parseSentiment(String raw) {
    if (raw == null || raw.isBlank()) {
      return OptionalDouble.empty();
    }
    Matcher matcher = NUMBER.matcher(raw);
    if (!matcher.find()) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(matcher.group()));
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }
}
