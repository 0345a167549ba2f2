package com.retailai.recommender.service.ai;

/** Common interface for text-generation providers (OpenAI, AWS Bedrock). */
public interface TextGenerator {

  /**
   * Produces a short natural-language explanation.
   *
   * @param context what to explain
   * @return the generated text
   * @throws com.retailai.recommender.exception.ExternalServiceException if the call fails
   */
  String explain(ExplanationContext context);

  /**
   * Gets the current model ID being used.
   *
   * @return The model identifier
   */
  String getCurrentModelId();

  /**
   * Checks if the service is properly configured.
   *
   * @return true if configured, false otherwise
   */
  boolean isConfigured();
}
