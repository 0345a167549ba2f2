package com.retailai.recommender.service.ai;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Best-effort explanations. Every failure, timeout or missing provider results in an empty
 * Optional; nothing is thrown to the caller.
 */
@Slf4j
@Service
public class ExplanationService {

  private final TextGeneratorSelector textGeneratorSelector;
  private final ThreadPoolTaskExecutor adapterCallExecutor;

  public ExplanationService(
      TextGeneratorSelector textGeneratorSelector,
      @Qualifier("adapterCallExecutor") ThreadPoolTaskExecutor adapterCallExecutor) {
    this.textGeneratorSelector = textGeneratorSelector;
    this.adapterCallExecutor = adapterCallExecutor;
  }

  public Optional<String> explain(ExplanationContext context, Duration timeout) {
    return explainAll(List.of(context), timeout).get(0);
  }

  /**
   * Requests all explanations in parallel and waits for them up to one shared deadline.
   *
   * @return one entry per context, in order; empty where no explanation arrived in time
   */
  public List<Optional<String>> explainAll(List<ExplanationContext> contexts, Duration timeout) {
    List<Optional<String>> results = new ArrayList<>(contexts.size());
    Optional<TextGenerator> selected = textGeneratorSelector.getTextGenerator();
    if (selected.isEmpty() || contexts.isEmpty()) {
      contexts.forEach(c -> results.add(Optional.empty()));
      return results;
    }
    TextGenerator generator = selected.get();

    List<Future<String>> futures = new ArrayList<>(contexts.size());
    for (ExplanationContext context : contexts) {
      try {
        futures.add(adapterCallExecutor.submit(() -> generator.explain(context)));
      } catch (TaskRejectedException e) {
        log.warn("Explanation request rejected, executor saturated: {}", e.getMessage());
        futures.add(null);
      }
    }

    long deadline = System.nanoTime() + timeout.toNanos();
    for (Future<String> future : futures) {
      results.add(await(future, deadline, generator));
    }
    return results;
  }

  private Optional<String> await(Future<String> future, long deadline, TextGenerator generator) {
    if (future == null) {
      return Optional.empty();
    }
    try {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      String text = future.get(remaining, TimeUnit.NANOSECONDS);
      return Optional.ofNullable(text).map(String::trim).filter(s -> !s.isEmpty());
    } catch (TimeoutException e) {
      future.cancel(true);
      log.debug("Explanation from {} timed out", generator.getCurrentModelId());
      return Optional.empty();
    } catch (ExecutionException e) {
      log.warn(
          "Explanation from {} failed: {}",
          generator.getCurrentModelId(),
          e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }
}
