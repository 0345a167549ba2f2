package com.retailai.recommender.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.index.IndexStatus;
import com.retailai.recommender.service.index.IndexManager;
import com.retailai.recommender.service.index.IndexType;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Tag(name = "Index", description = "Inspect and rebuild the vector indexes")
public class IndexController {

  private final IndexManager indexManager;

  @GetMapping("/status")
  @Operation(summary = "Status of every modality's published index")
  public ResponseEntity<List<IndexStatus>> status() {
    return ResponseEntity.ok(indexManager.status());
  }

  @PostMapping("/rebuild")
  @Operation(
      summary = "Rebuild an index from the stored embeddings",
      description =
          "Builds a new snapshot off to the side and publishes it atomically. Queries keep using"
              + " the previous snapshot until then.")
  public ResponseEntity<IndexStatus> rebuild(
      @Parameter(description = "Index to rebuild") @RequestParam Modality modality,
      @Parameter(description = "IVF or FLAT") @RequestParam(required = false) IndexType type,
      @Parameter(description = "Number of IVF lists") @RequestParam(required = false)
          Integer numLists) {
    log.info("Index rebuild requested for {} (type={}, numLists={})", modality, type, numLists);
    if (type == null && numLists == null) {
      indexManager.rebuild(modality);
    } else {
      indexManager.rebuild(
          modality,
          type != null ? type : IndexType.IVF,
          numLists != null ? numLists : indexManager.defaultNumLists());
    }
    return ResponseEntity.ok(indexManager.status(modality));
  }
}
