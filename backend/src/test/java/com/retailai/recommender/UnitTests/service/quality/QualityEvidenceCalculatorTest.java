package com.retailai.recommender.service.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.quality.QualityEvidence;
import com.retailai.recommender.fixtures.TestFixtures;

@DisplayName("QualityEvidenceCalculator Tests")
class QualityEvidenceCalculatorTest {

  private QualityEvidenceCalculator calculator;

  @BeforeEach
  void setUp() {
    calculator = new QualityEvidenceCalculator(new ApplicationProperties());
  }

  @Test
  @DisplayName("Should use sentiment sign when sentiment is parseable")
  void sentimentDecides() {
    QualityEvidence evidence =
        calculator.compute(
            "sku-1",
            List.of(
                TestFixtures.review("sku-1", 5, "-0.6"),
                TestFixtures.review("sku-1", 1, "score: 0.3"),
                TestFixtures.review("sku-1", 3, "0")));

    assertThat(evidence.getNegativeReviews()).isEqualTo(1);
    assertThat(evidence.getPositiveReviews()).isEqualTo(1);
    assertThat(evidence.getTotalReviews()).isEqualTo(3);
    assertThat(evidence.getAvgRating()).isCloseTo(3.0, within(1e-9));
  }

  @Test
  @DisplayName("Should fall back to rating when sentiment is missing or unparseable")
  void ratingFallback() {
    QualityEvidence evidence =
        calculator.compute(
            "sku-1",
            List.of(
                TestFixtures.review("sku-1", 4, null),
                TestFixtures.review("sku-1", 2, "n/a"),
                TestFixtures.review("sku-1", 3, "")));

    assertThat(evidence.getPositiveReviews()).isEqualTo(1);
    assertThat(evidence.getNegativeReviews()).isEqualTo(1);
    assertThat(evidence.getTotalReviews()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should produce zero evidence for an item without reviews")
  void noReviews() {
    QualityEvidence evidence = calculator.compute("sku-1", List.of());

    assertThat(evidence.getItemId()).isEqualTo("sku-1");
    assertThat(evidence.getTotalReviews()).isZero();
    assertThat(evidence.getAvgRating()).isZero();
  }

  @Test
  @DisplayName("Should extract the first number from a raw sentiment value")
  void parsesSentiment() {
    assertThat(QualityEvidenceCalculator.parseSentiment("0.8")).hasValue(0.8);
    assertThat(QualityEvidenceCalculator.parseSentiment("score: -0.4")).hasValue(-0.4);
    assertThat(QualityEvidenceCalculator.parseSentiment(".5 positive")).hasValue(0.5);
    assertThat(QualityEvidenceCalculator.parseSentiment("positive")).isEmpty();
    assertThat(QualityEvidenceCalculator.parseSentiment(null)).isEmpty();
  }
}
