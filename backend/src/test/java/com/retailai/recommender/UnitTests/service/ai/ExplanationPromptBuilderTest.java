package com.retailai.recommender.service.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.retailai.recommender.dto.quality.RiskLevel;
import com.retailai.recommender.fixtures.TestFixtures;

@DisplayName("ExplanationPromptBuilder Unit Tests")
class ExplanationPromptBuilderTest {

  private ExplanationPromptBuilder promptBuilder;

  @BeforeEach
  void setUp() {
    promptBuilder = new ExplanationPromptBuilder();
  }

  @Nested
  @DisplayName("Load Prompt Template Tests")
  class LoadPromptTemplateTests {

    @Test
    @DisplayName("Should load the recommendation template")
    void shouldLoadRecommendationTemplate() throws IOException {
      // When
      String template =
          promptBuilder.loadPromptTemplate(ExplanationPromptBuilder.RECOMMENDATION_TEMPLATE);

      // Then
      assertThat(template).contains("{{ANCHOR_NAME}}").contains("{{CANDIDATE_NAME}}");
    }

    @Test
    @DisplayName("Should throw IOException for a missing template")
    void shouldThrowForMissingTemplate() {
      // When & Then
      assertThatThrownBy(() -> promptBuilder.loadPromptTemplate("no-such-template"))
          .isInstanceOf(IOException.class)
          .hasMessageContaining("Failed to load prompt template: prompts/no-such-template.txt");
    }
  }

  @Nested
  @DisplayName("Build Prompt Tests")
  class BuildPromptTests {

    @Test
    @DisplayName("Should fill in anchor and candidate details")
    void shouldBuildRecommendationPrompt() throws IOException {
      // Given
      ExplanationContext context =
          ExplanationContext.builder()
              .kind(ExplanationContext.Kind.RECOMMENDATION)
              .anchorItemId("sku-1")
              .anchorName("Trail Runner")
              .anchorCategory("Footwear")
              .candidateItemId("sku-2")
              .candidateName("Hiking Socks")
              .candidateCategory("Apparel")
              .build();

      // When
      String prompt = promptBuilder.buildPrompt(context);

      // Then
      assertThat(prompt)
          .contains("Trail Runner")
          .contains("Footwear")
          .contains("Hiking Socks")
          .contains("Apparel")
          .doesNotContain("{{");
    }

    @Test
    @DisplayName("Should fall back to item ids when names are missing")
    void shouldFallBackToIds() throws IOException {
      // Given
      ExplanationContext context =
          ExplanationContext.builder()
              .kind(ExplanationContext.Kind.RECOMMENDATION)
              .anchorItemId("sku-1")
              .candidateItemId("sku-2")
              .build();

      // When
      String prompt = promptBuilder.buildPrompt(context);

      // Then
      assertThat(prompt).contains("sku-1").contains("sku-2").contains("unspecified");
    }

    @Test
    @DisplayName("Should include risk level and review counts in quality prompts")
    void shouldBuildQualityPrompt() throws IOException {
      // Given
      ExplanationContext context =
          ExplanationContext.builder()
              .kind(ExplanationContext.Kind.QUALITY_ALERT)
              .anchorItemId("sku-9")
              .anchorName("Leaky Bottle")
              .riskLevel(RiskLevel.HIGH_RISK)
              .evidence(TestFixtures.evidence(1, 4, 2.25))
              .build();

      // When
      String prompt = promptBuilder.buildPrompt(context);

      // Then
      assertThat(prompt)
          .contains("Leaky Bottle")
          .contains("HIGH_RISK")
          .contains("2.25")
          .doesNotContain("{{");
    }
  }
}
