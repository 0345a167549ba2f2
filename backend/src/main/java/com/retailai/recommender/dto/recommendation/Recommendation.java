package com.retailai.recommender.dto.recommendation;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {

  @JsonProperty("item_id")
  String itemId;

  @JsonProperty("distance")
  double distance;

  @JsonProperty("similarity")
  double similarity;

  /** 1-based position in the result. */
  @JsonProperty("rank")
  int rank;

  @JsonProperty("name")
  String name;

  @JsonProperty("category")
  String category;

  @JsonProperty("price")
  BigDecimal price;

  @JsonProperty("description")
  String description;

  /** Present only when the text generator answered in time. */
  @JsonProperty("explanation")
  String explanation;
}
