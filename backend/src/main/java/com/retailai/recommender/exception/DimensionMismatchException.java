package com.retailai.recommender.exception;

/** Thrown when a vector's length does not match the configured dimension. */
public class DimensionMismatchException extends RecommenderException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    this("Dimension mismatch: expected " + expected + ", got " + actual, expected, actual);
  }

  public DimensionMismatchException(String message, int expected, int actual) {
    super(message);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
