package com.retailai.recommender.exception;

/** Bad request parameter (k, num_lists) or, at startup, an inconsistent configuration. */
public class InvalidConfigException extends RecommenderException {

  public InvalidConfigException(String message) {
    super(message);
  }
}
