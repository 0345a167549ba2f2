package com.retailai.recommender.service.embedding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.EmbeddingHistory;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.exception.DimensionMismatchException;
import com.retailai.recommender.exception.ItemNotFoundException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory embedding store with per-key version history, optionally persisted as JSON.
 *
 * <p>Writes take the write lock and replace a key's immutable {@link Versions} holder, so a reader
 * holding the read lock sees every key either before or after a write, never in between.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class VersionedEmbeddingStore implements EmbeddingStore {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;
  private final Clock clock;

  private final Map<Key, Versions> entries = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private Path storeFile;

  @PostConstruct
  public void init() {
    String configured = applicationProperties.getEmbedding().getStoreFile();
    if (configured == null || configured.isBlank()) {
      log.info("Embedding store persistence disabled, keeping embeddings in memory only");
      return;
    }
    storeFile = Paths.get(configured);
    load();
  }

  @Override
  public Embedding upsert(String itemId, Modality modality, float[] vector) {
    return upsertAll(List.of(new EmbeddingWrite(itemId, modality, vector))).get(0);
  }

  @Override
  public List<Embedding> upsertAll(Collection<EmbeddingWrite> writes) {
    for (EmbeddingWrite write : writes) {
      checkDimension(write.getModality(), write.getVector());
    }

    List<Embedding> stored = new ArrayList<>(writes.size());
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      for (EmbeddingWrite write : writes) {
        Key key = new Key(write.getItemId(), write.getModality());
        Versions previous = entries.get(key);
        long version = previous == null ? 1 : previous.getLastVersion() + 1;

        Embedding embedding =
            Embedding.builder()
                .itemId(write.getItemId())
                .modality(write.getModality())
                .vector(write.getVector().clone())
                .dim(write.getVector().length)
                .createdAt(now)
                .sourceVersion(version)
                .build();

        List<Embedding> retired = new ArrayList<>();
        if (previous != null) {
          retired.add(previous.getCurrent());
          retired.addAll(previous.getRetired());
        }
        entries.put(key, new Versions(embedding, trim(retired), version));
        stored.add(embedding);
      }
    } finally {
      lock.writeLock().unlock();
    }

    log.debug("Stored {} embedding version(s)", stored.size());
    return stored;
  }

  @Override
  public Embedding get(String itemId, Modality modality) {
    return find(itemId, modality)
        .orElseThrow(
            () ->
                new ItemNotFoundException(
                    itemId, "No " + modality + " embedding for item '" + itemId + "'"));
  }

  @Override
  public Optional<Embedding> find(String itemId, Modality modality) {
    if (itemId == null || modality == null) {
      return Optional.empty();
    }
    lock.readLock().lock();
    try {
      Versions versions = entries.get(new Key(itemId, modality));
      return Optional.ofNullable(versions).map(Versions::getCurrent);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public boolean isStale(String itemId, Modality modality, Instant catalogLastModified) {
    Optional<Embedding> current = find(itemId, modality);
    if (current.isEmpty()) {
      return true;
    }
    return catalogLastModified != null
        && current.get().getCreatedAt().isBefore(catalogLastModified);
  }

  @Override
  public List<Embedding> currentEmbeddings(Modality modality) {
    lock.readLock().lock();
    try {
      List<Embedding> result = new ArrayList<>();
      for (Map.Entry<Key, Versions> entry : entries.entrySet()) {
        if (entry.getKey().getModality() == modality) {
          result.add(entry.getValue().getCurrent());
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<EmbeddingHistory> history(String itemId, Modality modality) {
    lock.readLock().lock();
    try {
      Versions versions = entries.get(new Key(itemId, modality));
      return Optional.ofNullable(versions).map(v -> toHistory(itemId, modality, v));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Embedding rollback(String itemId, Modality modality) {
    lock.writeLock().lock();
    try {
      Key key = new Key(itemId, modality);
      Versions versions = entries.get(key);
      if (versions == null || versions.getRetired().isEmpty()) {
        throw new ItemNotFoundException(
            itemId,
            "No retired " + modality + " embedding to roll back to for item '" + itemId + "'");
      }
      List<Embedding> retired = versions.getRetired();
      Embedding source = retired.get(0);
      long version = versions.getLastVersion() + 1;
      // A fresh createdAt keeps the refresh cycle from treating the rollback as stale
      Embedding reinstated =
          source.toBuilder().createdAt(clock.instant()).sourceVersion(version).build();

      List<Embedding> stillRetired = new ArrayList<>();
      stillRetired.add(versions.getCurrent());
      stillRetired.addAll(retired.subList(1, retired.size()));
      entries.put(key, new Versions(reinstated, trim(stillRetired), version));
      log.info(
          "Rolled back {} embedding of item {} from version {} to the vector of version {}"
              + " as version {}",
          modality,
          itemId,
          versions.getCurrent().getSourceVersion(),
          source.getSourceVersion(),
          version);
      return reinstated;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public int size(Modality modality) {
    lock.readLock().lock();
    try {
      return (int) entries.keySet().stream().filter(k -> k.getModality() == modality).count();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int dimension(Modality modality) {
    return applicationProperties.dimensionFor(modality);
  }

  /**
   * Writes the store to the configured file. The file is replaced atomically, so a crash during
   * the write leaves the previous file intact.
   *
   * @return true when the store was written
   */
  @Override
  public boolean persist() {
    if (storeFile == null) {
      return false;
    }
    List<EmbeddingHistory> records = new ArrayList<>();
    lock.readLock().lock();
    try {
      entries.forEach(
          (key, versions) -> records.add(toHistory(key.getItemId(), key.getModality(), versions)));
    } finally {
      lock.readLock().unlock();
    }

    try {
      Path parent = storeFile.toAbsolutePath().getParent();
      if (parent != null && !Files.exists(parent)) {
        Files.createDirectories(parent);
      }
      Path temp = storeFile.resolveSibling(storeFile.getFileName() + ".tmp");
      Files.write(temp, objectMapper.writeValueAsBytes(records));
      Files.move(
          temp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Persisted {} embedding keys to {}", records.size(), storeFile);
      return true;
    } catch (IOException e) {
      log.error("Failed to persist embedding store to {}", storeFile, e);
      return false;
    }
  }

  private void load() {
    if (!Files.exists(storeFile)) {
      log.info("No embedding store file at {}, starting empty", storeFile);
      return;
    }
    try {
      List<EmbeddingHistory> records =
          objectMapper.readValue(
              storeFile.toFile(),
              objectMapper
                  .getTypeFactory()
                  .constructCollectionType(List.class, EmbeddingHistory.class));

      lock.writeLock().lock();
      try {
        for (EmbeddingHistory record : records) {
          Embedding current = record.getCurrent();
          if (current == null || current.vectorView() == null) {
            continue;
          }
          int expected = dimension(record.getModality());
          if (current.vectorView().length != expected) {
            log.warn(
                "Skipping stored {} embedding of item {}: dimension {} does not match {}",
                record.getModality(),
                record.getItemId(),
                current.vectorView().length,
                expected);
            continue;
          }
          List<Embedding> retired =
              record.getRetired() == null
                  ? List.of()
                  : trim(new ArrayList<>(record.getRetired()));
          long lastVersion =
              retired.stream()
                  .mapToLong(Embedding::getSourceVersion)
                  .reduce(current.getSourceVersion(), Math::max);
          entries.put(
              new Key(record.getItemId(), record.getModality()),
              new Versions(current, retired, lastVersion));
        }
      } finally {
        lock.writeLock().unlock();
      }
      log.info("Loaded {} embedding keys from {}", entries.size(), storeFile);
    } catch (IOException e) {
      log.error("Failed to load embedding store from {}", storeFile, e);
    }
  }

  private void checkDimension(Modality modality, float[] vector) {
    int expected = dimension(modality);
    int actual = vector == null ? 0 : vector.length;
    if (actual != expected) {
      throw new DimensionMismatchException(
          modality + " embedding must have " + expected + " dimensions, got " + actual,
          expected,
          actual);
    }
  }

  private List<Embedding> trim(List<Embedding> retired) {
    int keep = Math.max(0, applicationProperties.getEmbedding().getRetentionVersions());
    return List.copyOf(retired.size() > keep ? retired.subList(0, keep) : retired);
  }

  private static EmbeddingHistory toHistory(String itemId, Modality modality, Versions versions) {
    return EmbeddingHistory.builder()
        .itemId(itemId)
        .modality(modality)
        .current(versions.getCurrent())
        .retired(new ArrayList<>(versions.getRetired()))
        .build();
  }

  @Value
  private static class Key {
    String itemId;
    Modality modality;
  }

  @Value
  private static class Versions {
    Embedding current;
    List<Embedding> retired;
    long lastVersion;
  }
}
