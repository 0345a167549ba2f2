package com.retailai.recommender.config;

import java.time.Clock;
import java.util.Map;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Bounded pool that computes embeddings during a refresh cycle, one task per item. */
  @Bean
  public ThreadPoolTaskExecutor refreshExecutor(ApplicationProperties properties) {
    int workers = properties.getRefresh().getWorkerThreads();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setThreadNamePrefix("refresh-worker-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  /** Runs individual adapter calls so the caller can stop waiting after a timeout. */
  @Bean
  public ThreadPoolTaskExecutor adapterCallExecutor(ApplicationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getRefresh().getWorkerThreads());
    executor.setMaxPoolSize(properties.getRefresh().getWorkerThreads() * 4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("adapter-call-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.initialize();
    return executor;
  }

  @Bean
  public RestTemplate restTemplate() {
    return new RestTemplate();
  }

  private static TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
