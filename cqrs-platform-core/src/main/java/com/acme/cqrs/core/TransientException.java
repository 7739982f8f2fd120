package com.acme.cqrs.core;

/** Infrastructure failure that may succeed when attempted again. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
