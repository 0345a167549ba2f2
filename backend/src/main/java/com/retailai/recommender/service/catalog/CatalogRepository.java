package com.retailai.recommender.service.catalog;

import java.util.List;
import java.util.Optional;

import com.retailai.recommender.dto.catalog.Item;

/** Read access to the product catalog, plus the write path used to feed it. */
public interface CatalogRepository {

  /**
   * Inserts or replaces an item. A missing {@code lastModified} is stamped with the current time.
   *
   * @param item the item to save
   * @return the saved item
   */
  Item save(Item item);

  Optional<Item> findById(String itemId);

  /** All items, ordered by item id. */
  List<Item> findAll();

  int count();
}
