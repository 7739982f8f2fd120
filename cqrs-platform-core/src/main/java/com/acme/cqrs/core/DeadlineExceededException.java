package com.acme.cqrs.core;

/** The dispatch deadline carried in the message context expired before the handler ran. */
public class DeadlineExceededException extends TransientException {
  public DeadlineExceededException(String message) {
    super(message);
  }

  public DeadlineExceededException(String message, Throwable e) {
    super(message, e);
  }
}
