package com.retailai.recommender.exception;

/** Thrown when an item, or an item's embedding for the requested modality, is unknown. */
public class ItemNotFoundException extends RecommenderException {

  private final String itemId;

  public ItemNotFoundException(String itemId, String message) {
    super(message);
    this.itemId = itemId;
  }

  public String getItemId() {
    return itemId;
  }
}
