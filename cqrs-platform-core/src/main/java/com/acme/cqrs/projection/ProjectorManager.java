package com.acme.cqrs.projection;

import com.acme.cqrs.message.DomainEvent;
import java.util.List;

/**
 * Best-effort read model maintenance. Projection failures stay inside the manager and never reach
 * the publishing caller.
 */
public interface ProjectorManager {

  void register(EventProjector<? extends DomainEvent> projector);

  void projectEvent(DomainEvent event);

  void projectEvents(List<? extends DomainEvent> events);

  void rebuildReadModel(String aggregateId, List<? extends DomainEvent> events);

  List<EventProjector<? extends DomainEvent>> getProjectors(String eventType);

  List<EventProjector<? extends DomainEvent>> getAllProjectors();

  boolean hasProjector(String projectorName);

  void removeProjector(String projectorName);

  void clear();
}
