package com.acme.cqrs.projection;

import com.acme.cqrs.message.DomainEvent;
import java.util.List;

/** Updates a read model from domain events. */
public interface EventProjector<E extends DomainEvent> {

  void project(E event);

  /** Unique name used for registration, enabling and statistics. */
  String getProjectorName();

  List<String> getProjectedEventTypes();

  default boolean canProject(DomainEvent event) {
    return getProjectedEventTypes().contains(event.eventType());
  }
}
