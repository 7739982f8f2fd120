package com.acme.cqrs.runtime;

import com.acme.cqrs.aggregate.AggregateFactory;
import com.acme.cqrs.aggregate.AggregateRepository;
import com.acme.cqrs.aggregate.AggregateRoot;
import com.acme.cqrs.bus.CqrsBus;
import com.acme.cqrs.config.RepositoryConfig;
import com.acme.cqrs.spi.Cache;
import com.acme.cqrs.spi.EventStore;
import com.acme.cqrs.spi.SnapshotStore;
import jakarta.inject.Singleton;

/**
 * Builds aggregate repositories over the configured stores. Committed events are published
 * through the {@link CqrsBus}, so they reach handlers and projectors.
 */
@Singleton
public class AggregateRepositories {

  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final Cache cache;
  private final CqrsBus cqrsBus;
  private final RepositoryConfig config;

  public AggregateRepositories(
      EventStore eventStore,
      SnapshotStore snapshotStore,
      Cache cache,
      CqrsBus cqrsBus,
      RepositoryConfig config) {
    this.eventStore = eventStore;
    this.snapshotStore = snapshotStore;
    this.cache = cache;
    this.cqrsBus = cqrsBus;
    this.config = config;
  }

  public <A extends AggregateRoot> AggregateRepository<A> create(
      String aggregateType, AggregateFactory<A> factory) {
    return new AggregateRepository<>(
        aggregateType, factory, eventStore, snapshotStore, cache, cqrsBus, config);
  }
}
