package com.acme.cqrs.message;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A fact recorded against one aggregate. {@code aggregateVersion} is the version the aggregate
 * reached by applying this event; versions of one aggregate are contiguous and start at 1.
 */
public abstract class DomainEvent extends Message {

  private final String aggregateId;
  private final long aggregateVersion;
  private final int eventVersion;

  protected DomainEvent(String aggregateId, long aggregateVersion, String tenantId) {
    this(aggregateId, aggregateVersion, tenantId, "", Map.of());
  }

  protected DomainEvent(
      String aggregateId,
      long aggregateVersion,
      String tenantId,
      String userId,
      Map<String, Object> metadata) {
    super(tenantId, userId, metadata);
    this.aggregateId = requireAggregateId(aggregateId);
    this.aggregateVersion = requireVersion(aggregateVersion);
    this.eventVersion = 1;
  }

  protected DomainEvent(
      UUID eventId,
      String aggregateId,
      long aggregateVersion,
      String tenantId,
      String userId,
      Instant occurredAt,
      Map<String, Object> metadata) {
    super(eventId, tenantId, userId, occurredAt, metadata);
    this.aggregateId = requireAggregateId(aggregateId);
    this.aggregateVersion = requireVersion(aggregateVersion);
    this.eventVersion = 1;
  }

  /** Used by codecs that populate fields reflectively. */
  protected DomainEvent() {
    super();
    this.aggregateId = null;
    this.aggregateVersion = 0;
    this.eventVersion = 1;
  }

  public abstract String eventType();

  @Override
  public final String messageType() {
    return eventType();
  }

  public UUID getEventId() {
    return getMessageId();
  }

  public String getAggregateId() {
    return aggregateId;
  }

  public long getAggregateVersion() {
    return aggregateVersion;
  }

  /** Schema version of the event payload. */
  public int getEventVersion() {
    return eventVersion;
  }

  public Instant getOccurredAt() {
    return getCreatedAt();
  }

  private static String requireAggregateId(String aggregateId) {
    if (aggregateId == null || aggregateId.isBlank()) {
      throw new IllegalArgumentException("Aggregate ID cannot be null or empty");
    }
    return aggregateId;
  }

  private static long requireVersion(long version) {
    if (version < 1) {
      throw new IllegalArgumentException("Aggregate version must be greater than 0: " + version);
    }
    return version;
  }
}
