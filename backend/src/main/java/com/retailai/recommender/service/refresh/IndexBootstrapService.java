package com.retailai.recommender.service.refresh;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.service.embedding.EmbeddingStore;
import com.retailai.recommender.service.index.IndexManager;
import com.retailai.recommender.service.index.IndexSnapshot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Builds the indexes from persisted embeddings once the application is ready. */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexBootstrapService {

  private final EmbeddingStore embeddingStore;
  private final IndexManager indexManager;

  @EventListener(ApplicationReadyEvent.class)
  public void buildIndexesOnStartup() {
    for (Modality modality : Modality.values()) {
      int stored = embeddingStore.size(modality);
      if (stored == 0) {
        log.info("No stored {} embeddings, {} index starts empty", modality, modality);
        continue;
      }
      try {
        IndexSnapshot snapshot = indexManager.rebuild(modality);
        log.info(
            "Startup {} index v{} ready with {} vectors",
            modality,
            snapshot.getVersion(),
            snapshot.size());
      } catch (RuntimeException e) {
        // The next refresh cycle rebuilds it
        log.error("Failed to build {} index on startup", modality, e);
      }
    }
  }
}
