package com.retailai.recommender.dto.catalog;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Catalog item. Owned by the catalog; this service only reads it. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Item {

  @NotBlank
  @JsonProperty("item_id")
  private String itemId;

  @JsonProperty("name")
  private String name;

  @JsonProperty("category")
  private String category;

  @JsonProperty("price")
  private BigDecimal price;

  @JsonProperty("description")
  private String description;

  /** Image location (file path or base64 payload) used for IMAGE embeddings. */
  @JsonProperty("image_ref")
  private String imageRef;

  @JsonProperty("last_modified")
  private Instant lastModified;
}
