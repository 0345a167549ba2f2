package com.retailai.recommender.service.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.stereotype.Repository;

import com.retailai.recommender.dto.catalog.ReviewRecord;

@Repository
public class InMemoryReviewRepository implements ReviewRepository {

  private final Map<String, List<ReviewRecord>> reviews = new ConcurrentHashMap<>();

  @Override
  public void add(ReviewRecord review) {
    if (review.getItemId() == null || review.getItemId().isBlank()) {
      throw new IllegalArgumentException("Review item id is required");
    }
    if (review.getRating() < 1 || review.getRating() > 5) {
      throw new IllegalArgumentException(
          "Rating must be between 1 and 5, got " + review.getRating());
    }
    reviews.computeIfAbsent(review.getItemId(), id -> new CopyOnWriteArrayList<>()).add(review);
  }

  @Override
  public List<ReviewRecord> findByItemId(String itemId) {
    return new ArrayList<>(reviews.getOrDefault(itemId, List.of()));
  }

  @Override
  public Map<String, List<ReviewRecord>> findAllGroupedByItem() {
    Map<String, List<ReviewRecord>> grouped = new TreeMap<>();
    reviews.forEach((itemId, list) -> grouped.put(itemId, new ArrayList<>(list)));
    return grouped;
  }
}
