package com.retailai.recommender.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.retailai.recommender.dto.refresh.RefreshReport;
import com.retailai.recommender.service.refresh.RefreshPipelineService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/refresh")
@RequiredArgsConstructor
@Tag(name = "Refresh", description = "Run and monitor refresh cycles")
public class RefreshController {

  private final RefreshPipelineService refreshPipelineService;

  @PostMapping
  @Operation(
      summary = "Run a refresh cycle",
      description =
          "Recomputes missing or stale embeddings, updates the indexes and regenerates quality"
              + " alerts. Returns SKIPPED_ALREADY_RUNNING if a cycle is in progress.")
  public ResponseEntity<RefreshReport> refresh() {
    log.info("Refresh cycle requested");
    return ResponseEntity.ok(refreshPipelineService.runCycle());
  }

  @PostMapping("/cancel")
  @Operation(summary = "Cancel the running refresh cycle")
  public ResponseEntity<Map<String, Object>> cancel() {
    return ResponseEntity.ok(Map.of("cancelled", refreshPipelineService.cancel()));
  }

  @GetMapping("/status")
  @Operation(summary = "Refresh status", description = "Running flag and the last cycle's report")
  public ResponseEntity<Map<String, Object>> status() {
    Map<String, Object> status = new HashMap<>();
    status.put("running", refreshPipelineService.isRunning());
    refreshPipelineService.getLastReport().ifPresent(report -> status.put("last_report", report));
    return ResponseEntity.ok(status);
  }
}
