package com.retailai.recommender.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.EmbeddingHistory;
import com.retailai.recommender.dto.embedding.EmbeddingUpsertRequest;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.service.embedding.EmbeddingService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/embeddings")
@RequiredArgsConstructor
@Tag(name = "Embeddings", description = "Inspect, write and roll back item embeddings")
public class EmbeddingController {

  private final EmbeddingService embeddingService;

  @PostMapping("/{itemId}/{modality}")
  @Operation(
      summary = "Write an embedding",
      description = "Stores a new current version and applies it to the modality's index")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Stored"),
        @ApiResponse(
            responseCode = "422",
            description = "Vector length differs from the modality's dimension")
      })
  public ResponseEntity<Embedding> upsert(
      @PathVariable String itemId,
      @PathVariable Modality modality,
      @Valid @RequestBody EmbeddingUpsertRequest request) {
    return ResponseEntity.ok(embeddingService.upsert(itemId, modality, request.getVector()));
  }

  @GetMapping("/{itemId}/{modality}")
  @Operation(summary = "Get the current embedding")
  public ResponseEntity<Embedding> get(
      @PathVariable String itemId, @PathVariable Modality modality) {
    return ResponseEntity.ok(embeddingService.get(itemId, modality));
  }

  @GetMapping("/{itemId}/{modality}/history")
  @Operation(summary = "Get the current and retained versions")
  public ResponseEntity<EmbeddingHistory> history(
      @PathVariable String itemId, @PathVariable Modality modality) {
    return ResponseEntity.ok(embeddingService.history(itemId, modality));
  }

  @PostMapping("/{itemId}/{modality}/rollback")
  @Operation(
      summary = "Roll back to the previous version",
      description = "Discards the current version and reinstates the most recent retired one")
  public ResponseEntity<Embedding> rollback(
      @PathVariable String itemId, @PathVariable Modality modality) {
    return ResponseEntity.ok(embeddingService.rollback(itemId, modality));
  }
}
