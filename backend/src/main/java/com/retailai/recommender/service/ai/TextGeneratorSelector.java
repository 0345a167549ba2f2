package com.retailai.recommender.service.ai;

import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the text generator from configuration. The preferred provider wins when configured,
 * otherwise any configured provider is used; {@code none} disables explanations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextGeneratorSelector {

  private final OpenAITextGenerator openAITextGenerator;
  private final BedrockTextGenerator bedrockTextGenerator;

  @Value("${ai.text-provider:openai}")
  private String preferredProvider;

  public Optional<TextGenerator> getTextGenerator() {
    if ("none".equalsIgnoreCase(preferredProvider)) {
      return Optional.empty();
    }

    if ("openai".equalsIgnoreCase(preferredProvider) && openAITextGenerator.isConfigured()) {
      return Optional.of(openAITextGenerator);
    }

    if ("bedrock".equalsIgnoreCase(preferredProvider) && bedrockTextGenerator.isConfigured()) {
      return Optional.of(bedrockTextGenerator);
    }

    if (openAITextGenerator.isConfigured()) {
      log.debug("Preferred provider {} not available, falling back to OpenAI", preferredProvider);
      return Optional.of(openAITextGenerator);
    }

    if (bedrockTextGenerator.isConfigured()) {
      log.debug(
          "Preferred provider {} not available, falling back to AWS Bedrock", preferredProvider);
      return Optional.of(bedrockTextGenerator);
    }

    return Optional.empty();
  }

  /**
   * Gets the currently active provider name.
   *
   * @return "openai", "bedrock" or "none"
   */
  public String getActiveProvider() {
    return getTextGenerator()
        .map(generator -> generator instanceof OpenAITextGenerator ? "openai" : "bedrock")
        .orElse("none");
  }
}
