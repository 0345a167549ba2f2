package com.retailai.recommender.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.refresh.IndexAction;
import com.retailai.recommender.dto.refresh.RefreshReport;
import com.retailai.recommender.dto.refresh.RefreshStatus;
import com.retailai.recommender.exception.GlobalExceptionHandler;
import com.retailai.recommender.service.refresh.RefreshPipelineService;

@ExtendWith(MockitoExtension.class)
@DisplayName("RefreshController Tests")
class RefreshControllerTest {

  private MockMvc mockMvc;

  @Mock private RefreshPipelineService refreshPipelineService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new RefreshController(refreshPipelineService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static RefreshReport report(RefreshStatus status) {
    RefreshReport report =
        RefreshReport.builder()
            .cycleId("cycle-1")
            .status(status)
            .startedAt(Instant.parse("2025-01-01T00:00:00Z"))
            .finishedAt(Instant.parse("2025-01-01T00:00:05Z"))
            .workItems(3)
            .embeddingsRefreshed(2)
            .failedItems(List.of("sku-3/TEXT"))
            .alertsGenerated(3)
            .build();
    report.getIndexActions().put(Modality.TEXT, IndexAction.FULL_BUILD);
    return report;
  }

  @Test
  @DisplayName("Should run a cycle and return its report")
  void runCycle() throws Exception {
    // Given
    when(refreshPipelineService.runCycle())
        .thenReturn(report(RefreshStatus.COMPLETED_WITH_FAILURES));

    // When & Then
    mockMvc
        .perform(post("/api/refresh"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED_WITH_FAILURES"))
        .andExpect(jsonPath("$.embeddings_refreshed").value(2))
        .andExpect(jsonPath("$.failed_items[0]").value("sku-3/TEXT"))
        .andExpect(jsonPath("$.index_actions.TEXT").value("FULL_BUILD"));
  }

  @Test
  @DisplayName("Should report whether a running cycle was cancelled")
  void cancel() throws Exception {
    // Given
    when(refreshPipelineService.cancel()).thenReturn(false);

    // When & Then
    mockMvc
        .perform(post("/api/refresh/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(false));
  }

  @Test
  @DisplayName("Should include the last report in the status once a cycle has run")
  void statusWithLastReport() throws Exception {
    // Given
    when(refreshPipelineService.isRunning()).thenReturn(true);
    when(refreshPipelineService.getLastReport())
        .thenReturn(Optional.of(report(RefreshStatus.COMPLETED)));

    // When & Then
    mockMvc
        .perform(get("/api/refresh/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(true))
        .andExpect(jsonPath("$.last_report.cycle_id").value("cycle-1"));
  }

  @Test
  @DisplayName("Should omit the last report before the first cycle")
  void statusBeforeFirstCycle() throws Exception {
    // Given
    when(refreshPipelineService.isRunning()).thenReturn(false);
    when(refreshPipelineService.getLastReport()).thenReturn(Optional.empty());

    // When & Then
    mockMvc
        .perform(get("/api/refresh/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(false))
        .andExpect(jsonPath("$.last_report").doesNotExist());
  }
}
