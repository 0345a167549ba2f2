package com.retailai.recommender.service.embedding;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.EmbeddingHistory;
import com.retailai.recommender.dto.embedding.Modality;

/** Versioned storage of per-item embeddings, at most one current version per (item, modality). */
public interface EmbeddingStore {

  /**
   * Writes a new current version, retiring the previous one.
   *
   * @param itemId the item identifier
   * @param modality the modality the vector was produced from
   * @param vector the embedding
   * @return the stored version
   * @throws com.retailai.recommender.exception.DimensionMismatchException if the vector length
   *     differs from the modality's configured dimension; the store is left unchanged
   */
  Embedding upsert(String itemId, Modality modality, float[] vector);

  /**
   * Writes several new versions as one unit: either every write is applied or, when any vector
   * has the wrong dimension, none is.
   *
   * @param writes the pending writes
   * @return the stored versions, in input order
   */
  List<Embedding> upsertAll(Collection<EmbeddingWrite> writes);

  /**
   * Looks up the current embedding.
   *
   * @throws com.retailai.recommender.exception.ItemNotFoundException if there is none
   */
  Embedding get(String itemId, Modality modality);

  Optional<Embedding> find(String itemId, Modality modality);

  /**
   * True when the current embedding was created before the item's last catalog change, or when
   * there is no current embedding at all.
   */
  boolean isStale(String itemId, Modality modality, Instant catalogLastModified);

  /** Current embeddings of one modality, read under a single consistent view. */
  List<Embedding> currentEmbeddings(Modality modality);

  Optional<EmbeddingHistory> history(String itemId, Modality modality);

  /**
   * Retires the current version and reinstates the vector of the most recent retired one as a
   * new current version, with the next source version and the current time.
   *
   * @throws com.retailai.recommender.exception.ItemNotFoundException if no retired version exists
   */
  Embedding rollback(String itemId, Modality modality);

  int size(Modality modality);

  int dimension(Modality modality);

  /**
   * Flushes the store to durable storage, if any is configured.
   *
   * @return true when the store was written
   */
  boolean persist();
}
