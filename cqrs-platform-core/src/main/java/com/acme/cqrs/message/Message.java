package com.acme.cqrs.message;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Base of every command, query and domain event. Carries identity, tenant and user of origin, a
 * UTC creation instant truncated to milliseconds and a free-form metadata map. Instances are
 * immutable once constructed.
 *
 * <p>Tenant and user travel explicitly with each message; no handler should look them up from a
 * thread-bound side channel.
 */
public abstract class Message {

  private final UUID messageId;
  private final String tenantId;
  private final String userId;
  private final Instant createdAt;
  private final Map<String, Object> metadata;

  protected Message(String tenantId, String userId, Map<String, Object> metadata) {
    this(UUID.randomUUID(), tenantId, userId, Instant.now(), metadata);
  }

  protected Message(
      UUID messageId,
      String tenantId,
      String userId,
      Instant createdAt,
      Map<String, Object> metadata) {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("Tenant ID cannot be null or empty");
    }
    this.messageId = Objects.requireNonNull(messageId, "messageId");
    this.tenantId = tenantId;
    this.userId = userId == null ? "" : userId;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt").truncatedTo(ChronoUnit.MILLIS);
    this.metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Used by codecs that populate fields reflectively. */
  protected Message() {
    this.messageId = null;
    this.tenantId = null;
    this.userId = "";
    this.createdAt = null;
    this.metadata = Map.of();
  }

  /** Routing discriminator of the concrete message. */
  public abstract String messageType();

  public UUID getMessageId() {
    return messageId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getUserId() {
    return userId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Map<String, Object> getMetadata() {
    return metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
  }

  public Object getMetadata(String key) {
    return getMetadata().get(key);
  }

  public boolean belongsToTenant(String tenant) {
    return Objects.equals(tenantId, tenant);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Objects.equals(messageId, ((Message) o).messageId);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(messageId);
  }

  @Override
  public String toString() {
    return messageType() + "(" + messageId + ")";
  }
}
