package com.retailai.recommender.service.catalog;

import java.util.List;
import java.util.Map;

import com.retailai.recommender.dto.catalog.ReviewRecord;

/** Source of raw customer reviews. */
public interface ReviewRepository {

  void add(ReviewRecord review);

  List<ReviewRecord> findByItemId(String itemId);

  /** Every review, grouped by item id. */
  Map<String, List<ReviewRecord>> findAllGroupedByItem();
}
