package com.retailai.recommender.exception;

/** Failure or timeout of an embedding or text-generation call. */
public class ExternalServiceException extends RecommenderException {

  private final String service;

  public ExternalServiceException(String service, String message) {
    super(message);
    this.service = service;
  }

  public ExternalServiceException(String service, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
  }

  public String getService() {
    return service;
  }
}
