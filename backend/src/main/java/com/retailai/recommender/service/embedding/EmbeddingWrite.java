package com.retailai.recommender.service.embedding;

import com.retailai.recommender.dto.embedding.Modality;

import lombok.Value;

/** A vector waiting to be written to the store. */
@Value
public class EmbeddingWrite {
  String itemId;
  Modality modality;
  float[] vector;
}
