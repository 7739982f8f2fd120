package com.acme.cqrs.core;

/** The resolved handler's {@code canHandle} predicate returned false for the message. */
public class HandlerRejectedException extends PermanentException {
  public HandlerRejectedException(String message) {
    super(message);
  }

  public HandlerRejectedException(String message, Throwable e) {
    super(message, e);
  }
}
