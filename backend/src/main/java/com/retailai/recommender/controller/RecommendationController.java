package com.retailai.recommender.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.recommendation.RecommendationResponse;
import com.retailai.recommender.service.recommendation.RecommendationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Recommendations", description = "Similar-item recommendations from the vector index")
public class RecommendationController {

  private final RecommendationService recommendationService;
  private final ApplicationProperties applicationProperties;

  @GetMapping("/items/{itemId}/recommendations")
  @Operation(
      summary = "Get similar items",
      description =
          "Returns up to k items nearest to the anchor by cosine distance, excluding the anchor"
              + " itself. Explanations are attached when the text generator answers in time.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Ranked recommendations, possibly fewer than k",
            content = @Content(schema = @Schema(implementation = RecommendationResponse.class))),
        @ApiResponse(responseCode = "400", description = "k out of range", content = @Content),
        @ApiResponse(
            responseCode = "404",
            description = "Anchor item has no embedding",
            content = @Content)
      })
  public ResponseEntity<RecommendationResponse> getRecommendations(
      @PathVariable String itemId,
      @Parameter(description = "Maximum number of results") @RequestParam(required = false)
          Integer k,
      @Parameter(description = "Embedding modality to compare") @RequestParam(required = false)
          Modality modality,
      @Parameter(description = "Attach generated explanations") @RequestParam(required = false)
          Boolean explain) {
    ApplicationProperties.Recommendation defaults = applicationProperties.getRecommendation();
    int effectiveK = k != null ? k : defaults.getDefaultK();
    Modality effectiveModality = modality != null ? modality : defaults.getDefaultModality();
    boolean effectiveExplain = explain != null ? explain : defaults.isExplanationsEnabled();

    log.info(
        "Recommendations requested for {} (k={}, modality={}, explain={})",
        itemId,
        effectiveK,
        effectiveModality,
        effectiveExplain);
    return ResponseEntity.ok(
        recommendationService.getRecommendations(
            itemId, effectiveK, effectiveModality, effectiveExplain));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }
}
