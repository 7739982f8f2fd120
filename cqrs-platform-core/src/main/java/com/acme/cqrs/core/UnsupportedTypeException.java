package com.acme.cqrs.core;

/** The handler's {@code supports(type)} returned false at registration time. */
public class UnsupportedTypeException extends PermanentException {
  private final String messageType;

  public UnsupportedTypeException(String messageType) {
    super("Handler does not support type: " + messageType);
    this.messageType = messageType;
  }

  public String getMessageType() {
    return messageType;
  }
}
