package com.cario.valuation.app.exception;

import org.springframework.http.HttpStatus;

/**
 * The vehicle-record lookup or price-discovery call failed. The message is a fixed, caller-safe
 * phrase; upstream details travel only in the cause and are logged, never serialized.
 */
public class CollaboratorException extends ValuationException {

  public CollaboratorException(String message) {
    super(message);
  }

  public CollaboratorException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
