package com.retailai.recommender.service.ai;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.exception.ExternalServiceException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Generates embeddings with the Amazon Titan models on AWS Bedrock: Titan Text Embeddings for
 * TEXT, Titan Multimodal Embeddings for IMAGE. The requested output length is the modality's
 * configured dimension.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BedrockEmbeddingProvider implements EmbeddingProvider {

  private static final String SERVICE = "bedrock-embedding";

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private final BedrockClientProvider clientProvider;

  @Value("${ai.embedding-provider:bedrock}")
  private String embeddingProvider;

  @Value("${aws.bedrock.embedding.text-model-id:amazon.titan-embed-text-v2:0}")
  private String textModelId;

  @Value("${aws.bedrock.embedding.image-model-id:amazon.titan-embed-image-v1}")
  private String imageModelId;

  @Override
  public boolean isConfigured() {
    return "bedrock".equalsIgnoreCase(embeddingProvider);
  }

  @Override
  public float[] embed(String content, Modality modality) {
    if (!isConfigured()) {
      throw new ExternalServiceException(SERVICE, "Embedding provider is disabled");
    }
    if (content == null || content.isBlank()) {
      throw new ExternalServiceException(SERVICE, "Nothing to embed for modality " + modality);
    }

    String modelId = modality == Modality.IMAGE ? imageModelId : textModelId;
    int dimension = applicationProperties.dimensionFor(modality);
    log.debug(
        "Generating {} embedding with {} for: {}",
        modality,
        modelId,
        content.substring(0, Math.min(content.length(), 100)));

    try {
      String payload =
          objectMapper.writeValueAsString(buildRequestBody(content, modality, dimension));

      InvokeModelRequest invokeRequest =
          InvokeModelRequest.builder()
              .modelId(modelId)
              .contentType("application/json")
              .accept("application/json")
              .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
              .build();

      InvokeModelResponse response = clientProvider.getClient().invokeModel(invokeRequest);
      return parseEmbedding(response.body().asUtf8String());
    } catch (ExternalServiceException e) {
      throw e;
    } catch (Exception e) {
      throw new ExternalServiceException(
          SERVICE, "Failed to generate " + modality + " embedding: " + e.getMessage(), e);
    }
  }

  Map<String, Object> buildRequestBody(String content, Modality modality, int dimension)
      throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    if (modality == Modality.IMAGE) {
      body.put("inputImage", toBase64Image(content));
      body.put("embeddingConfig", Map.of("outputEmbeddingLength", dimension));
    } else {
      body.put("inputText", content);
      body.put("dimensions", dimension);
      body.put("normalize", true);
    }
    return body;
  }

  float[] parseEmbedding(String responseJson) throws IOException {
    JsonNode embedding = objectMapper.readTree(responseJson).get("embedding");
    if (embedding == null || !embedding.isArray()) {
      throw new ExternalServiceException(SERVICE, "Response did not contain an embedding");
    }
    float[] vector = new float[embedding.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = (float) embedding.get(i).asDouble();
    }
    return vector;
  }

  /** Image references are either readable file paths or an already-encoded base64 payload. */
  private static String toBase64Image(String imageRef) throws IOException {
    Path path = asReadableFile(imageRef);
    if (path != null) {
      return Base64.getEncoder().encodeToString(Files.readAllBytes(path));
    }
    return imageRef;
  }

  private static Path asReadableFile(String imageRef) {
    if (imageRef.length() > 1024) {
      return null;
    }
    try {
      Path path = Paths.get(imageRef);
      return Files.isRegularFile(path) && Files.isReadable(path) ? path : null;
    } catch (InvalidPathException e) {
      return null;
    }
  }
}
