package com.retailai.recommender.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.retailai.recommender.dto.quality.Classification;
import com.retailai.recommender.dto.quality.QualityAlert;
import com.retailai.recommender.dto.quality.QualityEvidence;
import com.retailai.recommender.dto.quality.RiskLevel;
import com.retailai.recommender.service.quality.QualityAlertService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/quality")
@RequiredArgsConstructor
@Tag(name = "Quality", description = "Quality-risk alerts derived from customer reviews")
public class QualityController {

  private final QualityAlertService qualityAlertService;

  @GetMapping("/alerts")
  @Operation(
      summary = "Get current quality alerts",
      description =
          "Latest alert per item, most severe first. actionableOnly keeps HIGH_RISK and"
              + " MEDIUM_RISK.")
  public ResponseEntity<List<QualityAlert>> getAlerts(
      @Parameter(description = "Only this risk level") @RequestParam(required = false)
          RiskLevel riskLevel,
      @Parameter(description = "Only HIGH_RISK and MEDIUM_RISK")
          @RequestParam(defaultValue = "false")
          boolean actionableOnly) {
    List<QualityAlert> alerts = qualityAlertService.findAlerts(riskLevel, actionableOnly);
    log.debug("Returning {} quality alerts", alerts.size());
    return ResponseEntity.ok(alerts);
  }

  @GetMapping("/alerts/{itemId}")
  @Operation(summary = "Get the latest alert for an item")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Alert found"),
        @ApiResponse(responseCode = "404", description = "No alert for the item")
      })
  public ResponseEntity<QualityAlert> getAlert(@PathVariable String itemId) {
    return ResponseEntity.ok(qualityAlertService.getAlert(itemId));
  }

  @PostMapping("/classify")
  @Operation(
      summary = "Classify review evidence",
      description = "Runs the risk rules on the given evidence without storing anything")
  public ResponseEntity<Classification> classify(@Valid @RequestBody QualityEvidence evidence) {
    return ResponseEntity.ok(qualityAlertService.classify(evidence));
  }
}
