package com.retailai.recommender.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.retailai.recommender.dto.catalog.Item;
import com.retailai.recommender.dto.catalog.ReviewRecord;
import com.retailai.recommender.exception.ItemNotFoundException;
import com.retailai.recommender.service.catalog.CatalogRepository;
import com.retailai.recommender.service.catalog.ReviewRepository;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
@Tag(name = "Catalog", description = "Feed catalog items and reviews into the engine")
public class CatalogController {

  private final CatalogRepository catalogRepository;
  private final ReviewRepository reviewRepository;

  @PostMapping("/items")
  @Operation(
      summary = "Add or replace a catalog item",
      description = "The item's embeddings are recomputed by the next refresh cycle")
  public ResponseEntity<Item> saveItem(@Valid @RequestBody Item item) {
    Item saved = catalogRepository.save(item);
    log.info("Catalog item {} saved", saved.getItemId());
    return ResponseEntity.status(HttpStatus.CREATED).body(saved);
  }

  @GetMapping("/items/{itemId}")
  @Operation(summary = "Get a catalog item")
  public ResponseEntity<Item> getItem(@PathVariable String itemId) {
    return catalogRepository
        .findById(itemId)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ItemNotFoundException(itemId, "Item not found: " + itemId));
  }

  @PostMapping("/reviews")
  @Operation(
      summary = "Record a customer review",
      description = "Reviews feed the quality alerts on the next refresh cycle")
  public ResponseEntity<ReviewRecord> addReview(@Valid @RequestBody ReviewRecord review) {
    reviewRepository.add(review);
    return ResponseEntity.status(HttpStatus.CREATED).body(review);
  }
}
