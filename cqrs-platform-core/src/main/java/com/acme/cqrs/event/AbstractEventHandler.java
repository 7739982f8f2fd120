package com.acme.cqrs.event;

import com.acme.cqrs.message.DomainEvent;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event handler base that supports a fixed set of event types and remembers processed event ids,
 * so redelivery of the same event is a no-op. The id set lives in memory and is not bounded.
 */
public abstract class AbstractEventHandler<E extends DomainEvent> implements EventHandler<E> {

  private final Set<String> eventTypes;
  private final Set<UUID> processed = ConcurrentHashMap.newKeySet();

  protected AbstractEventHandler(String... eventTypes) {
    this.eventTypes = Set.of(eventTypes);
  }

  @Override
  public boolean supports(String eventType) {
    return eventTypes.contains(eventType);
  }

  @Override
  public boolean isEventProcessed(E event) {
    return processed.contains(event.getEventId());
  }

  @Override
  public void markEventAsProcessed(E event) {
    processed.add(event.getEventId());
  }

  public Set<String> getEventTypes() {
    return eventTypes;
  }
}
