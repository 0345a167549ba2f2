package com.retailai.recommender.service.ai;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/** Renders explanation prompts from the templates under {@code prompts/}. */
@Slf4j
@Component
public class ExplanationPromptBuilder {

  private static final String PROMPTS_PATH = "prompts/";
  static final String RECOMMENDATION_TEMPLATE = "recommendation-explanation";
  static final String QUALITY_TEMPLATE = "quality-explanation";

  private final Map<String, String> templates = new ConcurrentHashMap<>();

  public String buildPrompt(ExplanationContext context) throws IOException {
    if (context.getKind() == ExplanationContext.Kind.QUALITY_ALERT) {
      return buildQualityPrompt(context);
    }
    return buildRecommendationPrompt(context);
  }

  String buildRecommendationPrompt(ExplanationContext context) throws IOException {
    return loadPromptTemplate(RECOMMENDATION_TEMPLATE)
        .replace("{{ANCHOR_NAME}}", orFallback(context.getAnchorName(), context.getAnchorItemId()))
        .replace("{{ANCHOR_CATEGORY}}", orFallback(context.getAnchorCategory(), "unspecified"))
        .replace(
            "{{CANDIDATE_NAME}}",
            orFallback(context.getCandidateName(), context.getCandidateItemId()))
        .replace(
            "{{CANDIDATE_CATEGORY}}", orFallback(context.getCandidateCategory(), "unspecified"));
  }

  String buildQualityPrompt(ExplanationContext context) throws IOException {
    String template = loadPromptTemplate(QUALITY_TEMPLATE);
    String prompt =
        template
            .replace(
                "{{ITEM_NAME}}", orFallback(context.getAnchorName(), context.getAnchorItemId()))
            .replace(
                "{{RISK_LEVEL}}",
                context.getRiskLevel() == null ? "UNKNOWN" : context.getRiskLevel().name());
    if (context.getEvidence() != null) {
      prompt =
          prompt
              .replace(
                  "{{POSITIVE}}", String.valueOf(context.getEvidence().getPositiveReviews()))
              .replace(
                  "{{NEGATIVE}}", String.valueOf(context.getEvidence().getNegativeReviews()))
              .replace("{{TOTAL}}", String.valueOf(context.getEvidence().getTotalReviews()))
              .replace(
                  "{{AVG_RATING}}",
                  String.format(Locale.ROOT, "%.2f", context.getEvidence().getAvgRating()));
    }
    return prompt;
  }

  public String loadPromptTemplate(String promptName) throws IOException {
    String cached = templates.get(promptName);
    if (cached != null) {
      return cached;
    }
    String fileName = PROMPTS_PATH + promptName + ".txt";
    ClassPathResource resource = new ClassPathResource(fileName);

    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      String template = reader.lines().collect(Collectors.joining("\n"));
      templates.put(promptName, template);
      return template;
    } catch (IOException e) {
      log.error("Failed to load prompt template: {}", fileName, e);
      throw new IOException("Failed to load prompt template: " + fileName, e);
    }
  }

  private static String orFallback(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
