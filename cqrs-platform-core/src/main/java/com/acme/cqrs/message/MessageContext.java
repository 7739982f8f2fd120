package com.acme.cqrs.message;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * What middleware sees of a message in flight. {@code deadline} is null when the dispatch has no
 * time bound.
 */
public record MessageContext(
    String messageId,
    String tenantId,
    String userId,
    String messageType,
    Instant createdAt,
    Map<String, Object> metadata,
    Instant deadline) {

  public static MessageContext of(Message message, Duration timeout) {
    Instant deadline =
        timeout == null || timeout.isZero() || timeout.isNegative()
            ? null
            : Instant.now().plus(timeout);
    return new MessageContext(
        String.valueOf(message.getMessageId()),
        message.getTenantId(),
        message.getUserId(),
        message.messageType(),
        message.getCreatedAt(),
        message.getMetadata(),
        deadline);
  }

  public Optional<Instant> getDeadline() {
    return Optional.ofNullable(deadline);
  }

  public boolean isExpired() {
    return deadline != null && Instant.now().isAfter(deadline);
  }

  /** Time left until the deadline; {@code null} when unbounded. */
  public Duration remaining() {
    if (deadline == null) {
      return null;
    }
    Duration left = Duration.between(Instant.now(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }
}
