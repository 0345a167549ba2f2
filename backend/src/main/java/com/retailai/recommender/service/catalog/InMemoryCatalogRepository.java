package com.retailai.recommender.service.catalog;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.retailai.recommender.dto.catalog.Item;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryCatalogRepository implements CatalogRepository {

  private final Clock clock;

  private final Map<String, Item> items = new ConcurrentHashMap<>();

  @Override
  public Item save(Item item) {
    if (item.getItemId() == null || item.getItemId().isBlank()) {
      throw new IllegalArgumentException("Item id is required");
    }
    Item copy = item.toBuilder().build();
    if (copy.getLastModified() == null) {
      copy.setLastModified(clock.instant());
    }
    items.put(copy.getItemId(), copy);
    log.debug("Saved catalog item {} (last modified {})", copy.getItemId(), copy.getLastModified());
    return copy.toBuilder().build();
  }

  @Override
  public Optional<Item> findById(String itemId) {
    return Optional.ofNullable(items.get(itemId)).map(item -> item.toBuilder().build());
  }

  @Override
  public List<Item> findAll() {
    return items.values().stream()
        .sorted(Comparator.comparing(Item::getItemId))
        .map(item -> item.toBuilder().build())
        .collect(Collectors.toList());
  }

  @Override
  public int count() {
    return items.size();
  }
}
