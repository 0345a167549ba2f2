package com.retailai.recommender.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.retailai.recommender.dto.quality.Classification;
import com.retailai.recommender.dto.quality.QualityAlert;
import com.retailai.recommender.dto.quality.QualityEvidence;
import com.retailai.recommender.dto.quality.RiskLevel;
import com.retailai.recommender.exception.GlobalExceptionHandler;
import com.retailai.recommender.exception.ItemNotFoundException;
import com.retailai.recommender.service.quality.QualityAlertService;

@ExtendWith(MockitoExtension.class)
@DisplayName("QualityController Tests")
class QualityControllerTest {

  private MockMvc mockMvc;

  @Mock private QualityAlertService qualityAlertService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new QualityController(qualityAlertService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static QualityAlert alert(String itemId, RiskLevel level) {
    return QualityAlert.builder()
        .itemId(itemId)
        .riskLevel(level)
        .matchedRule("test-rule")
        .evidence(
            QualityEvidence.builder()
                .itemId(itemId)
                .positiveReviews(1)
                .negativeReviews(4)
                .avgRating(1.8)
                .totalReviews(5)
                .build())
        .generatedAt(Instant.parse("2025-01-01T00:00:00Z"))
        .build();
  }

  @Test
  @DisplayName("Should list alerts with no filters by default")
  void listAlerts() throws Exception {
    // Given
    when(qualityAlertService.findAlerts(null, false))
        .thenReturn(List.of(alert("sku-1", RiskLevel.HIGH_RISK), alert("sku-2", RiskLevel.OK)));

    // When & Then
    mockMvc
        .perform(get("/api/quality/alerts"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].risk_level").value("HIGH_RISK"))
        .andExpect(jsonPath("$[0].evidence.negative_reviews").value(4))
        .andExpect(jsonPath("$[0].explanation").doesNotExist());
  }

  @Test
  @DisplayName("Should forward the risk level and actionable filters")
  void filtersAlerts() throws Exception {
    // Given
    when(qualityAlertService.findAlerts(RiskLevel.MEDIUM_RISK, true)).thenReturn(List.of());

    // When & Then
    mockMvc
        .perform(
            get("/api/quality/alerts")
                .param("riskLevel", "MEDIUM_RISK")
                .param("actionableOnly", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
    verify(qualityAlertService).findAlerts(RiskLevel.MEDIUM_RISK, true);
  }

  @Test
  @DisplayName("Should return 404 when an item has no alert")
  void missingAlert() throws Exception {
    // Given
    when(qualityAlertService.getAlert("ghost"))
        .thenThrow(new ItemNotFoundException("ghost", "No quality alert for item: ghost"));

    // When & Then
    mockMvc.perform(get("/api/quality/alerts/ghost")).andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("Should classify ad-hoc evidence")
  void classify() throws Exception {
    // Given
    when(qualityAlertService.classify(any(QualityEvidence.class)))
        .thenReturn(new Classification(RiskLevel.HIGH_RISK, "many-negatives-low-rating"));

    // When & Then
    mockMvc
        .perform(
            post("/api/quality/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"item_id\": \"sku-1\", \"positive_reviews\": 1, \"negative_reviews\": 6,"
                        + " \"avg_rating\": 1.5, \"total_reviews\": 7}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.risk_level").value("HIGH_RISK"))
        .andExpect(jsonPath("$.matched_rule").value("many-negatives-low-rating"));
  }

  @Test
  @DisplayName("Should reject evidence with negative counts")
  void rejectInvalidEvidence() throws Exception {
    // When & Then
    mockMvc
        .perform(
            post("/api/quality/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"item_id\": \"sku-1\", \"positive_reviews\": -1, \"negative_reviews\": 0,"
                        + " \"avg_rating\": 3.0, \"total_reviews\": 0}"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(qualityAlertService);
  }
}
