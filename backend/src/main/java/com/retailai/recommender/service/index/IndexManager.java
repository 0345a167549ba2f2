package com.retailai.recommender.service.index;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Service;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.index.IndexStatus;
import com.retailai.recommender.dto.refresh.IndexAction;
import com.retailai.recommender.service.embedding.EmbeddingStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the published snapshot of each modality. Readers take the current reference and keep it
 * for the duration of a query; writers serialize per modality and swap in a replacement
 * atomically.
 */
@Slf4j
@Service
public class IndexManager {

  private final VectorIndexService vectorIndexService;
  private final EmbeddingStore embeddingStore;
  private final ApplicationProperties properties;
  private final Clock clock;

  private final Map<Modality, AtomicReference<IndexSnapshot>> published =
      new EnumMap<>(Modality.class);
  private final Map<Modality, ReentrantLock> mutationLocks = new EnumMap<>(Modality.class);

  public IndexManager(
      VectorIndexService vectorIndexService,
      EmbeddingStore embeddingStore,
      ApplicationProperties properties,
      Clock clock) {
    this.vectorIndexService = vectorIndexService;
    this.embeddingStore = embeddingStore;
    this.properties = properties;
    this.clock = clock;
    for (Modality modality : Modality.values()) {
      published.put(
          modality, new AtomicReference<>(vectorIndexService.emptySnapshot(modality)));
      mutationLocks.put(modality, new ReentrantLock());
    }
  }

  /** The snapshot queries should pin. Never null. */
  public IndexSnapshot current(Modality modality) {
    return published.get(modality).get();
  }

  /**
   * Derives and publishes a replacement snapshot while holding the modality's mutation lock, so
   * concurrent writers never publish over each other's changes.
   *
   * @param modality the index to replace
   * @param mutation receives the current snapshot and returns its successor
   * @return the published snapshot
   */
  public IndexSnapshot mutate(Modality modality, UnaryOperator<IndexSnapshot> mutation) {
    ReentrantLock lock = mutationLocks.get(modality);
    lock.lock();
    try {
      IndexSnapshot previous = current(modality);
      IndexSnapshot next = mutation.apply(previous);
      if (next != previous) {
        published.get(modality).set(next);
        log.info(
            "Published {} index v{} ({} vectors), replacing v{}",
            modality,
            next.getVersion(),
            next.size(),
            previous.getVersion());
      }
      return next;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Brings the index up to date with embeddings that were just committed to the store. Inserts
   * them incrementally unless the drift limit would be exceeded or the index was never built, in
   * which case the whole index is rebuilt from the store.
   *
   * @param modality the index to maintain
   * @param changed new vectors by item id
   * @return what was done
   */
  public IndexAction applyChanges(Modality modality, Map<String, float[]> changed) {
    AtomicReference<IndexAction> action = new AtomicReference<>(IndexAction.NONE);
    mutate(
        modality,
        current -> {
          if (changed.isEmpty() && (current.isBuilt() || embeddingStore.size(modality) == 0)) {
            return current;
          }
          if (vectorIndexService.requiresFullBuild(current, changed.size())) {
            action.set(IndexAction.FULL_BUILD);
            return vectorIndexService.build(modality, embeddingStore.currentEmbeddings(modality));
          }
          action.set(IndexAction.INCREMENTAL_INSERT);
          return vectorIndexService.insertAll(current, changed);
        });
    return action.get();
  }

  /** Full rebuild from the store's current embeddings. */
  public IndexSnapshot rebuild(Modality modality) {
    return mutate(
        modality,
        previous ->
            vectorIndexService.build(modality, embeddingStore.currentEmbeddings(modality)));
  }

  /**
   * Rebuilds with an explicit index type and list count, for tuning and diagnostics.
   */
  public IndexSnapshot rebuild(Modality modality, IndexType indexType, int numLists) {
    return mutate(
        modality,
        previous ->
            vectorIndexService.build(
                modality, embeddingStore.currentEmbeddings(modality), indexType, numLists));
  }

  public int defaultNumLists() {
    return properties.getIndex().getNumLists();
  }

  /** True when the snapshot is older than the configured maximum age. */
  public boolean isStale(IndexSnapshot snapshot) {
    Duration maxAge = properties.getIndex().getMaxSnapshotAge();
    return snapshot.getCreatedAt().plus(maxAge).isBefore(clock.instant());
  }

  public IndexStatus status(Modality modality) {
    IndexSnapshot snapshot = current(modality);
    return IndexStatus.builder()
        .modality(modality)
        .snapshotVersion(snapshot.getVersion())
        .indexType(snapshot.getIndexType().name())
        .dimension(snapshot.getDimension())
        .size(snapshot.size())
        .numLists(snapshot.numLists())
        .insertedSinceBuild(snapshot.getInsertedSinceBuild())
        .builtAt(snapshot.getBuiltAt())
        .createdAt(snapshot.getCreatedAt())
        .stale(isStale(snapshot))
        .build();
  }

  public List<IndexStatus> status() {
    List<IndexStatus> statuses = new ArrayList<>();
    for (Modality modality : Modality.values()) {
      statuses.add(status(modality));
    }
    return statuses;
  }
}
