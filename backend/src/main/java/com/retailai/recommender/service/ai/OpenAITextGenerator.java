package com.retailai.recommender.service.ai;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailai.recommender.exception.ExternalServiceException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Explanations through the OpenAI chat completions API. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAITextGenerator implements TextGenerator {

  private static final String SERVICE = "openai";
  private static final String OPENAI_API_URL = "https://api.openai.com/v1/chat/completions";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final ExplanationPromptBuilder promptBuilder;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.model:gpt-4o-mini}")
  private String model;

  @Value("${openai.max-tokens:256}")
  private int maxTokens;

  @Value("${openai.temperature:0.3}")
  private double temperature;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public String explain(ExplanationContext context) {
    if (!isConfigured()) {
      throw new ExternalServiceException(SERVICE, "OpenAI API key not configured");
    }

    try {
      String prompt = promptBuilder.buildPrompt(context);
      log.debug("OpenAI request model={}, maxTokens={}, prompt={}", model, maxTokens, prompt);

      var requestBody = objectMapper.createObjectNode();
      requestBody.put("model", model);
      requestBody.put("max_tokens", maxTokens);
      requestBody.put("temperature", temperature);

      var messages = objectMapper.createArrayNode();
      var message = objectMapper.createObjectNode();
      message.put("role", "user");
      message.put("content", prompt);
      messages.add(message);
      requestBody.set("messages", messages);

      HttpHeaders headers = new HttpHeaders();
      headers.setContentType(MediaType.APPLICATION_JSON);
      headers.setBearerAuth(openaiApiKey);

      HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);
      ResponseEntity<String> response =
          restTemplate.exchange(OPENAI_API_URL, HttpMethod.POST, entity, String.class);

      if (response.getBody() != null) {
        JsonNode choices = objectMapper.readTree(response.getBody()).get("choices");
        if (choices != null && choices.isArray() && choices.size() > 0) {
          JsonNode messageNode = choices.get(0).get("message");
          if (messageNode != null && messageNode.has("content")) {
            return messageNode.get("content").asText();
          }
        }
      }

      throw new ExternalServiceException(
          SERVICE, "Invalid response format from OpenAI API: status=" + response.getStatusCode());
    } catch (ExternalServiceException e) {
      throw e;
    } catch (Exception e) {
      throw new ExternalServiceException(SERVICE, "OpenAI API call failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }
}
