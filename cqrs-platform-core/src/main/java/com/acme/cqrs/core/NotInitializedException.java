package com.acme.cqrs.core;

/** Raised when the CQRS facade is used before {@code initialize()} or after {@code shutdown()}. */
public class NotInitializedException extends PermanentException {
  public NotInitializedException(String message) {
    super(message);
  }

  public NotInitializedException(String message, Throwable e) {
    super(message, e);
  }
}
