package com.acme.cqrs.message;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Intent to change state. Routed by {@link #commandType()} to exactly one handler; no result. */
public abstract class Command extends Message {

  protected Command(String tenantId, String userId) {
    super(tenantId, userId, Map.of());
  }

  protected Command(String tenantId, String userId, Map<String, Object> metadata) {
    super(tenantId, userId, metadata);
  }

  protected Command(
      UUID commandId,
      String tenantId,
      String userId,
      Instant createdAt,
      Map<String, Object> metadata) {
    super(commandId, tenantId, userId, createdAt, metadata);
  }

  public abstract String commandType();

  @Override
  public final String messageType() {
    return commandType();
  }

  public UUID getCommandId() {
    return getMessageId();
  }
}
