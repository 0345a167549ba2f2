package com.retailai.recommender.service.refresh;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import com.retailai.recommender.dto.refresh.RefreshReport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Runs refresh cycles on a fixed delay when {@code engine.refresh.schedule-enabled} is set. */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "engine.refresh", name = "schedule-enabled", havingValue = "true")
@RequiredArgsConstructor
public class RefreshScheduler {

  private final RefreshPipelineService refreshPipelineService;

  @Scheduled(
      fixedDelayString = "${engine.refresh.interval:PT15M}",
      initialDelayString = "${engine.refresh.interval:PT15M}")
  public void scheduledRefresh() {
    RefreshReport report = refreshPipelineService.runCycle();
    log.debug("Scheduled refresh finished with status {}", report.getStatus());
  }
}
