package com.acme.cqrs.event;

import com.acme.cqrs.message.DomainEvent;
import java.util.List;

/** Outbound side used by repositories to hand committed events to subscribers. */
public interface EventPublisher {

  void publish(DomainEvent event);

  void publishAll(List<? extends DomainEvent> events);
}
