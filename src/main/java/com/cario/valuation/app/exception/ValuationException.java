package com.cario.valuation.app.exception;

import org.springframework.http.HttpStatus;

/** Base type for every failure the valuation service reports to its callers. */
public abstract class ValuationException extends RuntimeException {

  protected ValuationException(String message) {
    super(message);
  }

  protected ValuationException(String message, Throwable cause) {
    super(message, cause);
  }

  /** HTTP status the API layer answers with. */
  public abstract HttpStatus getStatus();
}
