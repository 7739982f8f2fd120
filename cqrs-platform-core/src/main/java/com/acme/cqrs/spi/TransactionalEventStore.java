package com.acme.cqrs.spi;

import java.util.Collection;

/** An event store able to remove several streams in one transaction. */
public interface TransactionalEventStore extends EventStore {

  /** Removes all listed streams or none of them; returns how many existed. */
  int deleteAll(Collection<String> aggregateIds);
}
