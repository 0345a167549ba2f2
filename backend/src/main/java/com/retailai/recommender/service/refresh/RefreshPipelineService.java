package com.retailai.recommender.service.refresh;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.catalog.Item;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.refresh.IndexAction;
import com.retailai.recommender.dto.refresh.RefreshReport;
import com.retailai.recommender.dto.refresh.RefreshStatus;
import com.retailai.recommender.exception.DimensionMismatchException;
import com.retailai.recommender.exception.ExternalServiceException;
import com.retailai.recommender.service.ai.EmbeddingProvider;
import com.retailai.recommender.service.catalog.CatalogRepository;
import com.retailai.recommender.service.embedding.EmbeddingStore;
import com.retailai.recommender.service.embedding.EmbeddingWrite;
import com.retailai.recommender.service.index.IndexManager;
import com.retailai.recommender.service.quality.QualityAlertService;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Batch refresh cycle: recompute missing or stale embeddings on a bounded worker pool, commit
 * them to the store in one step, bring each modality's index up to date, then regenerate the
 * quality alerts.
 *
 * <p>A failed item is reported and picked up again by the next cycle. Nothing computed by a
 * cancelled cycle is committed.
 */
@Slf4j
@Service
public class RefreshPipelineService {

  static final String MDC_REFRESH_CYCLE = "refreshCycle";

  private final CatalogRepository catalogRepository;
  private final EmbeddingStore embeddingStore;
  private final EmbeddingProvider embeddingProvider;
  private final IndexManager indexManager;
  private final QualityAlertService qualityAlertService;
  private final RetryExecutor retryExecutor;
  private final ApplicationProperties applicationProperties;
  private final Clock clock;
  private final ThreadPoolTaskExecutor refreshExecutor;
  private final ThreadPoolTaskExecutor adapterCallExecutor;

  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicReference<RefreshReport> lastReport = new AtomicReference<>();
  private final ConcurrentLinkedQueue<Future<?>> inFlight = new ConcurrentLinkedQueue<>();
  private volatile boolean cancelRequested;

  public RefreshPipelineService(
      CatalogRepository catalogRepository,
      EmbeddingStore embeddingStore,
      EmbeddingProvider embeddingProvider,
      IndexManager indexManager,
      QualityAlertService qualityAlertService,
      RetryExecutor retryExecutor,
      ApplicationProperties applicationProperties,
      Clock clock,
      @Qualifier("refreshExecutor") ThreadPoolTaskExecutor refreshExecutor,
      @Qualifier("adapterCallExecutor") ThreadPoolTaskExecutor adapterCallExecutor) {
    this.catalogRepository = catalogRepository;
    this.embeddingStore = embeddingStore;
    this.embeddingProvider = embeddingProvider;
    this.indexManager = indexManager;
    this.qualityAlertService = qualityAlertService;
    this.retryExecutor = retryExecutor;
    this.applicationProperties = applicationProperties;
    this.clock = clock;
    this.refreshExecutor = refreshExecutor;
    this.adapterCallExecutor = adapterCallExecutor;
  }

  /**
   * Runs one cycle on the calling thread. Returns immediately with status
   * SKIPPED_ALREADY_RUNNING when another cycle is in progress.
   */
  public RefreshReport runCycle() {
    if (!running.compareAndSet(false, true)) {
      log.info("Refresh requested while a cycle is running, skipping");
      return RefreshReport.builder()
          .status(RefreshStatus.SKIPPED_ALREADY_RUNNING)
          .startedAt(clock.instant())
          .finishedAt(clock.instant())
          .message("A refresh cycle is already running")
          .build();
    }

    String cycleId = UUID.randomUUID().toString().substring(0, 8);
    MDC.put(MDC_REFRESH_CYCLE, cycleId);
    Instant startedAt = clock.instant();
    RefreshReport report;
    try {
      report = executeCycle(cycleId, startedAt);
    } catch (RuntimeException e) {
      log.error("Refresh cycle {} failed", cycleId, e);
      report =
          RefreshReport.builder()
              .cycleId(cycleId)
              .status(RefreshStatus.FAILED)
              .startedAt(startedAt)
              .finishedAt(clock.instant())
              .message(e.getMessage())
              .build();
    } finally {
      inFlight.clear();
      cancelRequested = false;
      running.set(false);
      MDC.remove(MDC_REFRESH_CYCLE);
    }
    lastReport.set(report);
    return report;
  }

  /**
   * Requests cancellation of the running cycle. Items still being computed are abandoned and
   * reported as failed; the store and the published indexes keep their previous state.
   *
   * @return false when no cycle was running
   */
  public boolean cancel() {
    if (!running.get()) {
      return false;
    }
    cancelRequested = true;
    for (Future<?> future : inFlight) {
      future.cancel(true);
    }
    log.info("Cancellation requested for the running refresh cycle");
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  public Optional<RefreshReport> getLastReport() {
    return Optional.ofNullable(lastReport.get());
  }

  private RefreshReport executeCycle(String cycleId, Instant startedAt) {
    List<WorkItem> workItems = findWork();
    log.info("Refresh cycle {} started: {} embeddings to compute", cycleId, workItems.size());

    Map<WorkItem, Future<float[]>> futures = new LinkedHashMap<>();
    for (WorkItem work : workItems) {
      if (cancelRequested) {
        break;
      }
      Future<float[]> future = refreshExecutor.submit(() -> computeEmbedding(work));
      inFlight.add(future);
      futures.put(work, future);
    }

    List<EmbeddingWrite> staged = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (WorkItem work : workItems) {
      Future<float[]> future = futures.get(work);
      if (future == null) {
        failed.add(work.key());
        continue;
      }
      if (cancelRequested) {
        future.cancel(true);
      }
      try {
        float[] vector = future.get();
        staged.add(new EmbeddingWrite(work.getItem().getItemId(), work.getModality(), vector));
      } catch (CancellationException e) {
        failed.add(work.key());
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.warn("Embedding for {} failed this cycle: {}", work.key(), cause.getMessage());
        failed.add(work.key());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelRequested = true;
        futures.values().forEach(f -> f.cancel(true));
        failed.add(work.key());
      }
    }

    RefreshReport.RefreshReportBuilder report =
        RefreshReport.builder()
            .cycleId(cycleId)
            .startedAt(startedAt)
            .workItems(workItems.size())
            .failedItems(failed);

    if (cancelRequested) {
      log.info(
          "Refresh cycle {} cancelled, discarding {} computed embeddings", cycleId, staged.size());
      return report
          .status(RefreshStatus.CANCELLED)
          .finishedAt(clock.instant())
          .message("Cancelled before commit; nothing was published")
          .build();
    }

    if (!staged.isEmpty()) {
      embeddingStore.upsertAll(staged);
    }

    Map<Modality, IndexAction> indexActions = new EnumMap<>(Modality.class);
    for (Modality modality : applicationProperties.getRefresh().getModalities()) {
      Map<String, float[]> changed = new LinkedHashMap<>();
      for (EmbeddingWrite write : staged) {
        if (write.getModality() == modality) {
          changed.put(write.getItemId(), write.getVector());
        }
      }
      indexActions.put(modality, indexManager.applyChanges(modality, changed));
    }

    int alerts = qualityAlertService.regenerateAll();
    if (!staged.isEmpty()) {
      embeddingStore.persist();
    }

    RefreshStatus status =
        failed.isEmpty() ? RefreshStatus.COMPLETED : RefreshStatus.COMPLETED_WITH_FAILURES;
    log.info(
        "Refresh cycle {} {}: {} refreshed, {} failed, index {}, {} alerts",
        cycleId,
        status,
        staged.size(),
        failed.size(),
        indexActions,
        alerts);
    return report
        .status(status)
        .finishedAt(clock.instant())
        .embeddingsRefreshed(staged.size())
        .indexActions(indexActions)
        .alertsGenerated(alerts)
        .build();
  }

  /** Pairs of (item, modality) whose embedding is missing or older than the catalog entry. */
  List<WorkItem> findWork() {
    List<Modality> modalities = applicationProperties.getRefresh().getModalities();
    List<WorkItem> work = new ArrayList<>();
    for (Item item : catalogRepository.findAll()) {
      for (Modality modality : modalities) {
        String content = contentFor(item, modality);
        if (content == null) {
          continue;
        }
        if (embeddingStore.isStale(item.getItemId(), modality, item.getLastModified())) {
          work.add(new WorkItem(item, modality, content));
        }
      }
    }
    return work;
  }

  /** Text sent to the embedding model; null when the item has nothing to embed. */
  static String contentFor(Item item, Modality modality) {
    if (modality == Modality.IMAGE) {
      return item.getImageRef() == null || item.getImageRef().isBlank()
          ? null
          : item.getImageRef();
    }
    StringBuilder text = new StringBuilder();
    if (item.getName() != null && !item.getName().isBlank()) {
      text.append("Product: ").append(item.getName()).append("\n");
    }
    if (item.getCategory() != null && !item.getCategory().isBlank()) {
      text.append("Category: ").append(item.getCategory()).append("\n");
    }
    if (item.getDescription() != null && !item.getDescription().isBlank()) {
      text.append("Description: ").append(item.getDescription());
    }
    String content = text.toString().trim();
    return content.isEmpty() ? null : content;
  }

  private float[] computeEmbedding(WorkItem work) {
    Duration timeout = applicationProperties.getRefresh().getItemTimeout();
    float[] vector =
        retryExecutor.execute(
            "Embedding " + work.key(),
            () -> callWithTimeout(work.getContent(), work.getModality(), timeout));

    int expected = embeddingStore.dimension(work.getModality());
    int actual = vector == null ? 0 : vector.length;
    if (actual != expected) {
      throw new DimensionMismatchException(
          "Provider returned a " + actual + "-dimensional vector for " + work.key(),
          expected,
          actual);
    }
    return vector;
  }

  private float[] callWithTimeout(String content, Modality modality, Duration timeout) {
    Future<float[]> call =
        adapterCallExecutor.submit(() -> embeddingProvider.embed(content, modality));
    try {
      return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new ExternalServiceException(
          "embedding", "Embedding call timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ExternalServiceException) {
        throw (ExternalServiceException) cause;
      }
      throw new ExternalServiceException(
          "embedding", "Embedding call failed: " + (cause != null ? cause.getMessage() : e), e);
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExternalServiceException("embedding", "Embedding call interrupted", e);
    }
  }

  /** One (item, modality) pair to embed. */
  @Getter
  @RequiredArgsConstructor
  static final class WorkItem {
    private final Item item;
    private final Modality modality;
    private final String content;

    String key() {
      return item.getItemId() + "/" + modality;
    }
  }
}
