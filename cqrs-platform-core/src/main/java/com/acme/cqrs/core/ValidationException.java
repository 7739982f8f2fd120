package com.acme.cqrs.core;

/** Raised by a handler's validate step; never retried. */
public class ValidationException extends PermanentException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable e) {
    super(message, e);
  }
}
