package com.cario.valuation.app.exception;

import org.springframework.http.HttpStatus;

/** A collaborator credential has not been configured. */
public class MissingCredentialException extends ValuationException {

  public MissingCredentialException(String message) {
    super(message);
  }

  @Override
  public HttpStatus getStatus() {
    return HttpStatus.UNAUTHORIZED;
  }
}
