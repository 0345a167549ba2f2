package com.retailai.recommender.service.ai;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.retailai.recommender.exception.ExternalServiceException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;

/**
 * Explanations through the Bedrock Converse API, which works with every Bedrock chat model
 * without model-specific request formats.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BedrockTextGenerator implements TextGenerator {

  private static final String SERVICE = "bedrock-text";

  private final BedrockClientProvider clientProvider;
  private final ExplanationPromptBuilder promptBuilder;

  @Value("${aws.bedrock.text.enabled:false}")
  private boolean enabled;

  @Value("${aws.bedrock.text.model-id:anthropic.claude-3-haiku-20240307-v1:0}")
  private String modelId;

  @Value("${aws.bedrock.text.max-tokens:256}")
  private int maxTokens;

  @Value("${aws.bedrock.text.temperature:0.3}")
  private double temperature;

  @Override
  public boolean isConfigured() {
    return enabled && modelId != null && !modelId.trim().isEmpty();
  }

  @Override
  public String explain(ExplanationContext context) {
    if (!isConfigured()) {
      throw new ExternalServiceException(SERVICE, "AWS Bedrock text generation is not enabled");
    }

    try {
      String prompt = promptBuilder.buildPrompt(context);
      log.debug("Sending prompt to AWS Bedrock model {}:\n{}", modelId, prompt);

      Message userMessage =
          Message.builder()
              .role(ConversationRole.USER)
              .content(ContentBlock.builder().text(prompt).build())
              .build();

      ConverseRequest converseRequest =
          ConverseRequest.builder()
              .modelId(modelId)
              .messages(List.of(userMessage))
              .inferenceConfig(
                  InferenceConfiguration.builder()
                      .maxTokens(maxTokens)
                      .temperature((float) temperature)
                      .build())
              .build();

      ConverseResponse response = clientProvider.getClient().converse(converseRequest);
      Message responseMessage = response.output().message();
      if (responseMessage != null && !responseMessage.content().isEmpty()) {
        String text = responseMessage.content().get(0).text();
        if (text != null) {
          return text;
        }
      }
      throw new ExternalServiceException(SERVICE, "No content in model response");
    } catch (ExternalServiceException e) {
      throw e;
    } catch (Exception e) {
      throw new ExternalServiceException(
          SERVICE, "AWS Bedrock call to " + modelId + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String getCurrentModelId() {
    return modelId;
  }
}
