package com.acme.cqrs.core;

/** Wraps a failure of an event store, snapshot store or cache. */
public class PersistenceException extends TransientException {
  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable e) {
    super(message, e);
  }
}
