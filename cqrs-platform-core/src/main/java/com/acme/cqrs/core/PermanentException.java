package com.acme.cqrs.core;

/** Failure that will not go away on retry. Retry loops must fail fast on it. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
