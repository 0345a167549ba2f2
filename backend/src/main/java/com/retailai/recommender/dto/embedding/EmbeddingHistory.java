package com.retailai.recommender.dto.embedding;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current and retained versions of one (item, modality) key. Also the on-disk record format of
 * the embedding store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingHistory {

  private String itemId;

  private Modality modality;

  private Embedding current;

  /** Retired versions, most recent first. */
  @Builder.Default private List<Embedding> retired = new ArrayList<>();
}
