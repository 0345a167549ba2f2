package com.retailai.recommender.service.embedding;

import java.util.Map;

import org.springframework.stereotype.Service;

import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.EmbeddingHistory;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.refresh.IndexAction;
import com.retailai.recommender.exception.ItemNotFoundException;
import com.retailai.recommender.service.index.IndexManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Direct embedding writes outside a refresh cycle. Each write is committed to the store first and
 * then applied to the modality's index, so the index never holds a vector the store does not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

  private final EmbeddingStore embeddingStore;
  private final IndexManager indexManager;

  public Embedding upsert(String itemId, Modality modality, float[] vector) {
    Embedding stored = embeddingStore.upsert(itemId, modality, vector);
    IndexAction action = indexManager.applyChanges(modality, Map.of(itemId, stored.vectorView()));
    embeddingStore.persist();
    log.info(
        "Stored {} embedding v{} for item {} (index: {})",
        modality,
        stored.getSourceVersion(),
        itemId,
        action);
    return stored;
  }

  public Embedding get(String itemId, Modality modality) {
    return embeddingStore.get(itemId, modality);
  }

  public EmbeddingHistory history(String itemId, Modality modality) {
    return embeddingStore
        .history(itemId, modality)
        .orElseThrow(
            () ->
                new ItemNotFoundException(
                    itemId, "No " + modality + " embedding for item: " + itemId));
  }

  /** Reinstates the previous version and re-indexes it. */
  public Embedding rollback(String itemId, Modality modality) {
    Embedding reinstated = embeddingStore.rollback(itemId, modality);
    indexManager.applyChanges(modality, Map.of(itemId, reinstated.vectorView()));
    embeddingStore.persist();
    log.info(
        "Rolled back {} embedding of item {} to v{}",
        modality,
        itemId,
        reinstated.getSourceVersion());
    return reinstated;
  }
}
