package com.retailai.recommender.service.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.exception.DimensionMismatchException;
import com.retailai.recommender.exception.ExternalServiceException;

@DisplayName("RetryExecutor Tests")
class RetryExecutorTest {

  private ApplicationProperties properties;
  private List<Long> sleeps;
  private RetryExecutor retryExecutor;

  @BeforeEach
  void setUp() {
    properties = new ApplicationProperties();
    properties.getRetry().setMaxAttempts(4);
    properties.getRetry().setBackoffMs(100);
    properties.getRetry().setMultiplier(2.0);
    properties.getRetry().setMaxBackoffMs(300);
    sleeps = new ArrayList<>();
    retryExecutor = new RetryExecutor(properties, sleeps::add);
  }

  @Test
  @DisplayName("Should return the first successful result without sleeping")
  void succeedsFirstTime() {
    assertThat(retryExecutor.execute("call", () -> "ok")).isEqualTo("ok");
    assertThat(sleeps).isEmpty();
  }

  @Test
  @DisplayName("Should retry external failures with capped exponential backoff")
  void retriesWithBackoff() {
    AtomicInteger calls = new AtomicInteger();

    String result =
        retryExecutor.execute(
            "call",
            () -> {
              if (calls.incrementAndGet() < 4) {
                throw new ExternalServiceException("test", "flaky");
              }
              return "ok";
            });

    assertThat(result).isEqualTo("ok");
    assertThat(calls.get()).isEqualTo(4);
    assertThat(sleeps).containsExactly(100L, 200L, 300L);
  }

  @Test
  @DisplayName("Should rethrow the last failure once attempts are exhausted")
  void givesUpAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                retryExecutor.execute(
                    "call",
                    () -> {
                      throw new ExternalServiceException(
                          "test", "failure " + calls.incrementAndGet());
                    }))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessage("failure 4");
    assertThat(sleeps).hasSize(3);
  }

  @Test
  @DisplayName("Should not retry failures that are not external")
  void doesNotRetryOtherFailures() {
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(
            () ->
                retryExecutor.execute(
                    "call",
                    () -> {
                      calls.incrementAndGet();
                      throw new DimensionMismatchException(4, 3);
                    }))
        .isInstanceOf(DimensionMismatchException.class);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should compute the backoff schedule from the configuration")
  void backoffSchedule() {
    assertThat(retryExecutor.backoffMillis(1)).isEqualTo(100);
    assertThat(retryExecutor.backoffMillis(2)).isEqualTo(200);
    assertThat(retryExecutor.backoffMillis(3)).isEqualTo(300);
    assertThat(retryExecutor.backoffMillis(10)).isEqualTo(300);
  }

  @Test
  @DisplayName("Should stop retrying when interrupted while backing off")
  void stopsWhenInterrupted() {
    RetryExecutor interrupting =
        new RetryExecutor(
            properties,
            millis -> {
              throw new InterruptedException("stop");
            });
    AtomicInteger calls = new AtomicInteger();

    try {
      assertThatThrownBy(
              () ->
                  interrupting.execute(
                      "call",
                      () -> {
                        calls.incrementAndGet();
                        throw new ExternalServiceException("test", "flaky");
                      }))
          .isInstanceOf(ExternalServiceException.class)
          .hasMessageContaining("interrupted");
      assertThat(calls.get()).isEqualTo(1);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }
}
