package com.retailai.recommender.dto.refresh;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.retailai.recommender.dto.embedding.Modality;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Summary of one refresh cycle. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshReport {

  @JsonProperty("cycle_id")
  private String cycleId;

  @JsonProperty("status")
  private RefreshStatus status;

  @JsonProperty("started_at")
  private Instant startedAt;

  @JsonProperty("finished_at")
  private Instant finishedAt;

  /** Number of (item, modality) pairs that needed a new embedding. */
  @JsonProperty("work_items")
  private int workItems;

  @JsonProperty("embeddings_refreshed")
  private int embeddingsRefreshed;

  /** Keys formatted as {@code itemId/MODALITY}; retried on the next cycle. */
  @JsonProperty("failed_items")
  @Builder.Default
  private List<String> failedItems = new ArrayList<>();

  @JsonProperty("index_actions")
  @Builder.Default
  private Map<Modality, IndexAction> indexActions = new EnumMap<>(Modality.class);

  @JsonProperty("alerts_generated")
  private int alertsGenerated;

  @JsonProperty("message")
  private String message;
}
