package com.acme.cqrs.projection;

import com.acme.cqrs.message.DomainEvent;
import java.util.List;

/** A projector that can rebuild its read model for one aggregate from the full stream. */
public interface ReadModelProjector<E extends DomainEvent> extends EventProjector<E> {

  void rebuildReadModel(String aggregateId, List<E> events);

  String getReadModelType();
}
