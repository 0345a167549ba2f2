package com.retailai.recommender.service.index;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.exception.DimensionMismatchException;
import com.retailai.recommender.exception.InvalidConfigException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds, queries and incrementally extends IVF snapshots. Stateless apart from the version
 * counter; publishing snapshots is {@link IndexManager}'s job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorIndexService {

  private final ApplicationProperties properties;
  private final Clock clock;

  private final AtomicLong versionCounter = new AtomicLong();

  /** Builds an IVF snapshot with the configured number of lists. */
  public IndexSnapshot build(Modality modality, Collection<Embedding> embeddings) {
    return build(modality, embeddings, IndexType.IVF, properties.getIndex().getNumLists());
  }

  /**
   * Builds a new snapshot from scratch.
   *
   * @param modality modality the vectors belong to
   * @param embeddings vectors to index; a repeated item id keeps its last vector
   * @param indexType IVF for a partitioned index, FLAT for a single exact list
   * @param numLists requested partitions; capped at the number of vectors
   * @return the new snapshot, not yet published
   * @throws InvalidConfigException if {@code numLists < 1}
   * @throws DimensionMismatchException if any vector differs from the modality's dimension
   */
  public IndexSnapshot build(
      Modality modality, Collection<Embedding> embeddings, IndexType indexType, int numLists) {
    if (numLists < 1) {
      throw new InvalidConfigException("num_lists must be at least 1, got " + numLists);
    }
    int dimension = properties.dimensionFor(modality);
    long started = System.currentTimeMillis();

    // Sorted by id so that the same corpus always trains the same centroids
    Map<String, float[]> byId = new LinkedHashMap<>();
    embeddings.stream()
        .sorted(Comparator.comparing(Embedding::getItemId))
        .forEach(
            e -> {
              float[] vector = e.vectorView();
              if (vector == null || vector.length != dimension) {
                throw new DimensionMismatchException(
                    "Embedding for item " + e.getItemId() + " has the wrong dimension",
                    dimension,
                    vector == null ? 0 : vector.length);
              }
              byId.put(e.getItemId(), CosineDistance.normalize(vector));
            });

    String[] ids = byId.keySet().toArray(new String[0]);
    float[][] points = byId.values().toArray(new float[0][]);

    float[][] centroids;
    if (points.length == 0) {
      centroids = new float[0][];
    } else if (indexType == IndexType.FLAT) {
      centroids = new float[][] {meanDirection(points, dimension)};
    } else {
      int effectiveLists = Math.min(numLists, points.length);
      centroids =
          SphericalKMeans.train(
              points,
              effectiveLists,
              properties.getIndex().getKmeansIterations(),
              new Random(properties.getIndex().getSeed()));
    }

    List<List<Integer>> members = new ArrayList<>();
    for (int c = 0; c < centroids.length; c++) {
      members.add(new ArrayList<>());
    }
    Map<String, Integer> assignments = new HashMap<>();
    for (int i = 0; i < points.length; i++) {
      int list = indexType == IndexType.FLAT ? 0 : IndexSnapshot.nearestList(centroids, points[i]);
      members.get(list).add(i);
      assignments.put(ids[i], list);
    }

    List<InvertedList> lists = new ArrayList<>(centroids.length);
    for (List<Integer> positions : members) {
      String[] listIds = new String[positions.size()];
      float[][] listVectors = new float[positions.size()][];
      for (int j = 0; j < positions.size(); j++) {
        listIds[j] = ids[positions.get(j)];
        listVectors[j] = points[positions.get(j)];
      }
      lists.add(new InvertedList(listIds, listVectors));
    }

    Instant now = clock.instant();
    IndexSnapshot snapshot =
        new IndexSnapshot(
            versionCounter.incrementAndGet(),
            modality,
            indexType,
            dimension,
            centroids,
            lists,
            assignments,
            points.length,
            0,
            now,
            now);
    log.info(
        "Built {} {} index v{}: {} vectors in {} lists ({} ms)",
        indexType,
        modality,
        snapshot.getVersion(),
        snapshot.size(),
        snapshot.numLists(),
        System.currentTimeMillis() - started);
    return snapshot;
  }

  /** Queries with the configured number of probes. */
  public List<Neighbor> query(IndexSnapshot snapshot, float[] vector, int topK) {
    return query(snapshot, vector, topK, properties.getIndex().getNumProbes());
  }

  /**
   * Approximate nearest neighbours by cosine distance.
   *
   * @param snapshot the pinned snapshot to search
   * @param vector query vector
   * @param topK maximum number of hits
   * @param numProbes lists to scan, clamped to [1, numLists]
   * @return at most {@code topK} hits, ascending by distance then item id; empty for an empty index
   */
  public List<Neighbor> query(IndexSnapshot snapshot, float[] vector, int topK, int numProbes) {
    if (topK <= 0) {
      throw new InvalidConfigException("top_k must be positive, got " + topK);
    }
    if (vector.length != snapshot.getDimension()) {
      throw new DimensionMismatchException(snapshot.getDimension(), vector.length);
    }
    if (snapshot.isEmpty()) {
      return List.of();
    }

    float[] query = CosineDistance.normalize(vector);
    int lists = snapshot.numLists();
    int probes = Math.max(1, Math.min(numProbes, lists));

    Integer[] order = new Integer[lists];
    double[] centroidDistance = new double[lists];
    for (int c = 0; c < lists; c++) {
      order[c] = c;
      centroidDistance[c] = CosineDistance.unitDistance(snapshot.centroid(c), query);
    }
    Arrays.sort(order, Comparator.comparingDouble(c -> centroidDistance[c]));

    PriorityQueue<Neighbor> heap =
        new PriorityQueue<>(topK + 1, Neighbor.BY_DISTANCE_THEN_ID.reversed());
    for (int p = 0; p < probes; p++) {
      InvertedList list = snapshot.list(order[p]);
      for (int j = 0; j < list.size(); j++) {
        double d = CosineDistance.unitDistance(query, list.vectorAt(j));
        if (heap.size() == topK && d > heap.peek().getDistance()) {
          continue;
        }
        Neighbor candidate = new Neighbor(list.idAt(j), d);
        if (heap.size() < topK) {
          heap.add(candidate);
        } else if (Neighbor.BY_DISTANCE_THEN_ID.compare(candidate, heap.peek()) < 0) {
          heap.poll();
          heap.add(candidate);
        }
      }
    }

    List<Neighbor> result = new ArrayList<>(heap);
    result.sort(Neighbor.BY_DISTANCE_THEN_ID);
    return result;
  }

  public IndexSnapshot insert(IndexSnapshot snapshot, String itemId, float[] vector) {
    return insertAll(snapshot, Map.of(itemId, vector));
  }

  /**
   * Adds vectors to the nearest existing lists without retraining, returning a new snapshot. The
   * given snapshot is not modified.
   *
   * @throws DimensionMismatchException if any vector differs from the snapshot's dimension
   */
  public IndexSnapshot insertAll(IndexSnapshot snapshot, Map<String, float[]> vectors) {
    Map<String, float[]> normalized = new LinkedHashMap<>();
    vectors.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(
            entry -> {
              if (entry.getValue().length != snapshot.getDimension()) {
                throw new DimensionMismatchException(
                    "Embedding for item " + entry.getKey() + " has the wrong dimension",
                    snapshot.getDimension(),
                    entry.getValue().length);
              }
              normalized.put(entry.getKey(), CosineDistance.normalize(entry.getValue()));
            });
    if (normalized.isEmpty()) {
      return snapshot;
    }
    IndexSnapshot next =
        snapshot.withInserts(versionCounter.incrementAndGet(), normalized, clock.instant());
    log.debug(
        "Inserted {} vectors into {} index v{} -> v{}",
        normalized.size(),
        snapshot.getModality(),
        snapshot.getVersion(),
        next.getVersion());
    return next;
  }

  /**
   * True when applying {@code pendingInserts} more inserts would push the inserted-since-build
   * count past the configured fraction of the index size, or when the index was never built.
   */
  public boolean requiresFullBuild(IndexSnapshot snapshot, int pendingInserts) {
    if (!snapshot.isBuilt() || snapshot.numLists() == 0) {
      return true;
    }
    double inserted = snapshot.getInsertedSinceBuild() + (double) pendingInserts;
    double base = Math.max(snapshot.size(), 1);
    return inserted / base > properties.getIndex().getMaxInsertFraction();
  }

  /** Unpublished, never-built placeholder for a modality. */
  public IndexSnapshot emptySnapshot(Modality modality) {
    return IndexSnapshot.empty(modality, properties.dimensionFor(modality), clock.instant());
  }

  private static float[] meanDirection(float[][] points, int dimension) {
    float[] sum = new float[dimension];
    for (float[] point : points) {
      for (int d = 0; d < dimension; d++) {
        sum[d] += point[d];
      }
    }
    return CosineDistance.normalize(sum);
  }
}
