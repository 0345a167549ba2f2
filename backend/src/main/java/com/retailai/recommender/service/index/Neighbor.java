package com.retailai.recommender.service.index;

import java.util.Comparator;

import lombok.Value;

/** One query hit. */
@Value
public class Neighbor {

  /** Ascending distance, ties broken by ascending item id. */
  public static final Comparator<Neighbor> BY_DISTANCE_THEN_ID =
      Comparator.comparingDouble(Neighbor::getDistance).thenComparing(Neighbor::getItemId);

  String itemId;
  double distance;
}
