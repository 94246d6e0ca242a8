package com.cario.valuation.app.exception;

import org.springframework.http.HttpStatus;

/** A required vehicle attribute (make, model or manufacturing date) is absent or unparseable. */
public class NormalizationException extends ValuationException {

  public NormalizationException(String message) {
    super(message);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.BAD_REQUEST;
  }
}
