package com.acme.cqrs.event;

import com.acme.cqrs.message.DomainEvent;
import java.time.Duration;

/**
 * Reacts to one or more event types. Any number of handlers may be registered for the same type;
 * each delivery is isolated from its siblings.
 *
 * <p>Delivery order per handler: {@link #shouldIgnore}, {@link #isEventProcessed}, {@link
 * #validateEvent}, {@link #canHandle}, {@link #handle} (retried up to {@link #getMaxRetries}
 * times), {@link #markEventAsProcessed}. Any failure ends in {@link #handleFailure}.
 */
public interface EventHandler<E extends DomainEvent> {

  void handle(E event);

  boolean supports(String eventType);

  default void validateEvent(E event) {}

  default boolean canHandle(E event) {
    return true;
  }

  default int getPriority() {
    return 0;
  }

  default int getMaxRetries(E event) {
    return 3;
  }

  /** Pause before retry number {@code retryCount} (1-based). */
  default Duration getRetryDelay(E event, int retryCount) {
    return Duration.ofSeconds(retryCount);
  }

  default boolean shouldIgnore(E event) {
    return false;
  }

  default boolean isEventProcessed(E event) {
    return false;
  }

  default void markEventAsProcessed(E event) {}

  /** Called once retries are exhausted or a pre-handle step failed. Must not throw. */
  default void handleFailure(E event, Throwable error) {}
}
