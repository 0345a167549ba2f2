package com.retailai.recommender.dto.embedding;

/** Content modality an embedding was produced from. Each modality has its own dimension. */
public enum Modality {
  TEXT,
  IMAGE
}
