package com.retailai.recommender.service.ai;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

/**
 * Lazily creates the shared Bedrock runtime client. Credentials come from the default AWS chain,
 * so nothing is contacted until the first embedding or generation call.
 */
@Slf4j
@Component
public class BedrockClientProvider {

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  private volatile BedrockRuntimeClient client;

  public BedrockRuntimeClient getClient() {
    BedrockRuntimeClient current = client;
    if (current == null) {
      synchronized (this) {
        current = client;
        if (current == null) {
          current =
              BedrockRuntimeClient.builder()
                  .region(Region.of(awsRegion))
                  .credentialsProvider(DefaultCredentialsProvider.create())
                  .build();
          client = current;
          log.info("Bedrock runtime client initialized for region {}", awsRegion);
        }
      }
    }
    return current;
  }

  public String getRegion() {
    return awsRegion;
  }

  @PreDestroy
  public void close() {
    BedrockRuntimeClient current = client;
    if (current != null) {
      current.close();
    }
  }
}
