package com.retailai.recommender.service.ai;

import com.retailai.recommender.dto.embedding.Modality;

/** Contract of the external embedding model. */
public interface EmbeddingProvider {

  /**
   * Computes an embedding.
   *
   * @param content item text for TEXT, an image reference (file path or base64 payload) for IMAGE
   * @param modality which model to use
   * @return the vector; callers must still check its length
   * @throws com.retailai.recommender.exception.ExternalServiceException on any failure
   */
  float[] embed(String content, Modality modality);

  /**
   * Checks if the provider is properly configured.
   *
   * @return true if configured, false otherwise
   */
  boolean isConfigured();
}
