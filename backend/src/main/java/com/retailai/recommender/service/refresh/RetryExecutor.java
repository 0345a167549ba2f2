package com.retailai.recommender.service.refresh;

import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.exception.ExternalServiceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Retries external calls with bounded exponential backoff. Only {@link ExternalServiceException}
 * is retried; any other exception is a property of the input and fails immediately.
 *
 * <p>The delay before retry N (1-based) is {@code min(backoff-ms * multiplier^(N-1),
 * max-backoff-ms)}.
 */
@Slf4j
@Component
public class RetryExecutor {

  /** Pause between attempts; replaced in tests. */
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final ApplicationProperties applicationProperties;
  private final Sleeper sleeper;

  @Autowired
  public RetryExecutor(ApplicationProperties applicationProperties) {
    this(applicationProperties, Thread::sleep);
  }

  RetryExecutor(ApplicationProperties applicationProperties, Sleeper sleeper) {
    this.applicationProperties = applicationProperties;
    this.sleeper = sleeper;
  }

  /**
   * Runs the call, retrying on external failures up to the configured number of attempts.
   *
   * @param description what is being attempted, for logging
   * @param call the call
   * @return the call's result
   * @throws ExternalServiceException the last failure once attempts are exhausted, or when the
   *     calling thread is interrupted
   */
  public <T> T execute(String description, Supplier<T> call) {
    int maxAttempts = Math.max(1, applicationProperties.getRetry().getMaxAttempts());
    ExternalServiceException lastFailure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return call.get();
      } catch (ExternalServiceException e) {
        lastFailure = e;
        if (Thread.currentThread().isInterrupted()) {
          throw e;
        }
        if (attempt == maxAttempts) {
          break;
        }
        long delay = backoffMillis(attempt);
        log.warn(
            "{} failed (attempt {}/{}): {}. Retrying in {} ms",
            description,
            attempt,
            maxAttempts,
            e.getMessage(),
            delay);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new ExternalServiceException(e.getService(), description + " interrupted", ie);
        }
      }
    }

    log.warn("{} failed after {} attempts", description, maxAttempts);
    throw lastFailure;
  }

  long backoffMillis(int attempt) {
    ApplicationProperties.Retry retry = applicationProperties.getRetry();
    double delay = retry.getBackoffMs() * Math.pow(retry.getMultiplier(), attempt - 1);
    return (long) Math.min(delay, retry.getMaxBackoffMs());
  }
}
