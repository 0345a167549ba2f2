package com.retailai.recommender.exception;

/** Base class of the engine's errors, so callers can catch them together. */
public class RecommenderException extends RuntimeException {

  public RecommenderException(String message) {
    super(message);
  }

  public RecommenderException(String message, Throwable cause) {
    super(message, cause);
  }
}
