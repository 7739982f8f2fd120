package com.acme.cqrs.core;

/** No handler is registered for the dispatched message type. */
public class HandlerNotFoundException extends PermanentException {
  private final String messageType;

  public HandlerNotFoundException(String messageType) {
    super("No handler registered for type: " + messageType);
    this.messageType = messageType;
  }

  public String getMessageType() {
    return messageType;
  }
}
