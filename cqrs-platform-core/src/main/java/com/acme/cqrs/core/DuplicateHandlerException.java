package com.acme.cqrs.core;

/** A single-handler bus already holds a handler for the type; the existing one is kept. */
public class DuplicateHandlerException extends PermanentException {
  private final String messageType;

  public DuplicateHandlerException(String messageType) {
    super("Handler already registered for type: " + messageType);
    this.messageType = messageType;
  }

  public String getMessageType() {
    return messageType;
  }
}
