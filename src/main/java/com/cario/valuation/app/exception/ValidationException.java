package com.cario.valuation.app.exception;

import org.springframework.http.HttpStatus;

/** Missing or malformed input field. Never retried. */
public class ValidationException extends ValuationException {

  public ValidationException(String message) {
    super(message);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.BAD_REQUEST;
  }
}
