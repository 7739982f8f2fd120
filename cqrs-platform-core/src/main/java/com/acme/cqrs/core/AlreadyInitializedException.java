package com.acme.cqrs.core;

/** Raised by a second {@code initialize()} call. */
public class AlreadyInitializedException extends PermanentException {
  public AlreadyInitializedException(String message) {
    super(message);
  }

  public AlreadyInitializedException(String message, Throwable e) {
    super(message, e);
  }
}
