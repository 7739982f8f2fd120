package com.acme.cqrs.aggregate;

import com.acme.cqrs.config.RepositoryConfig;
import com.acme.cqrs.core.ConcurrencyConflictException;
import com.acme.cqrs.core.EntityNotFoundException;
import com.acme.cqrs.core.TransientException;
import com.acme.cqrs.event.EventPublisher;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.spi.Cache;
import com.acme.cqrs.spi.EventStore;
import com.acme.cqrs.spi.SnapshotStore;
import com.acme.cqrs.spi.TransactionalEventStore;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event-sourced repository for one aggregate type.
 *
 * <p>The event store is the source of truth. Snapshots are written every {@code snapshotInterval}
 * versions to shorten replay, and the cache holds the latest {@link Snapshot} of each loaded
 * aggregate so every read hands out a fresh instance. With {@code eventStoreEnabled = false} the
 * snapshot store keeps the materialized state instead and is rewritten on every save.
 *
 * <p>{@link #save}, {@link #delete} and {@link #deleteAll} retry {@link TransientException}s up to
 * {@code maxRetries} attempts with a delay of {@code retryDelay * attempt}; every other failure,
 * {@link ConcurrencyConflictException} included, surfaces on the first attempt.
 */
public class AggregateRepository<A extends AggregateRoot> {
  private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

  private final String aggregateType;
  private final AggregateFactory<A> factory;
  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final Cache cache;
  private final EventPublisher publisher;
  private final RepositoryConfig config;

  public AggregateRepository(
      String aggregateType,
      AggregateFactory<A> factory,
      EventStore eventStore,
      SnapshotStore snapshotStore,
      Cache cache,
      EventPublisher publisher,
      RepositoryConfig config) {
    this.aggregateType = aggregateType;
    this.factory = factory;
    this.eventStore = eventStore;
    this.snapshotStore = snapshotStore;
    this.cache = cache;
    this.publisher = publisher;
    this.config = config;
  }

  /**
   * Persists the aggregate's uncommitted events, refreshes the cache, then publishes the events
   * and snapshots on the configured cadence. The cache holds the stored version even when
   * publishing fails afterwards.
   *
   * @throws ConcurrencyConflictException if the stored version differs from the version the
   *     aggregate was loaded at; nothing is appended and the cache entry is dropped
   */
  public void save(A aggregate) {
    withRetry(
        "save",
        aggregate.getId(),
        () -> {
          doSave(aggregate);
          return null;
        });
  }

  public void saveAll(Collection<A> aggregates) {
    for (A aggregate : aggregates) {
      save(aggregate);
    }
  }

  private void doSave(A aggregate) {
    String id = aggregate.getId();
    long expectedVersion = aggregate.getCommittedVersion();
    List<DomainEvent> events = aggregate.getUncommittedEvents();
    try {
      if (config.isOptimisticLockingEnabled()) {
        checkConcurrency(id, expectedVersion);
      }
      if (config.isEventStoreEnabled()) {
        if (!events.isEmpty()) {
          long appendAt =
              config.isOptimisticLockingEnabled() ? expectedVersion : EventStore.ANY_VERSION;
          eventStore.append(id, appendAt, events);
        }
      } else {
        snapshotStore.put(aggregate.toSnapshot());
      }
    } catch (ConcurrencyConflictException e) {
      // cached copy is behind the store
      cache.del(aggregateType, id);
      throw e;
    }
    aggregate.markEventsAsCommitted();
    log.debug(
        "Saved {} {} at version {} ({} new events)",
        aggregateType,
        id,
        aggregate.getVersion(),
        events.size());

    Snapshot committed = aggregate.toSnapshot();
    if (config.isCacheEnabled()) {
      cache.set(aggregateType, id, committed, config.getCacheTtl());
    }

    if (config.isEventPublishingEnabled() && !events.isEmpty()) {
      publisher.publishAll(events);
    }

    if (config.isEventStoreEnabled() && shouldSnapshot(aggregate.getVersion())) {
      snapshotStore.put(committed);
      log.info("Created snapshot of {} {} at version {}", aggregateType, id, committed.version());
    }
  }

  private void checkConcurrency(String id, long expectedVersion) {
    long actualVersion =
        config.isEventStoreEnabled()
            ? eventStore.readVersion(id)
            : snapshotStore.get(id).map(Snapshot::version).orElse(0L);
    if (actualVersion != expectedVersion) {
      log.warn(
          "Concurrency conflict on {} {}: expected version {}, found {}",
          aggregateType,
          id,
          expectedVersion,
          actualVersion);
      throw new ConcurrencyConflictException(id, expectedVersion, actualVersion);
    }
  }

  private boolean shouldSnapshot(long version) {
    return config.isSnapshotEnabled()
        && version > 0
        && version % config.getSnapshotInterval() == 0;
  }

  /**
   * Loads the aggregate from, in order: the cache, the latest snapshot plus newer events, the
   * full event stream, the stored state. Returns null when none of them knows the id.
   */
  public A findById(String id) {
    if (config.isCacheEnabled()) {
      Optional<Object> cached = cache.get(aggregateType, id);
      if (cached.isPresent() && cached.get() instanceof Snapshot) {
        log.debug("Cache hit for {} {}", aggregateType, id);
        return rehydrate((Snapshot) cached.get());
      }
    }

    boolean snapshotRead = false;
    if (config.isSnapshotEnabled()) {
      snapshotRead = true;
      Optional<Snapshot> snapshot = snapshotStore.get(id);
      if (snapshot.isPresent()) {
        A aggregate = rehydrate(snapshot.get());
        if (config.isEventStoreEnabled()) {
          aggregate.replay(eventStore.readEvents(id, snapshot.get().version() + 1, null));
        }
        return remember(aggregate);
      }
    }

    if (config.isEventStoreEnabled()) {
      List<DomainEvent> history = eventStore.readEvents(id);
      if (!history.isEmpty()) {
        A aggregate = factory.newInstance(id);
        aggregate.replay(history);
        return remember(aggregate);
      }
    }

    if (!snapshotRead) {
      Optional<Snapshot> state = snapshotStore.get(id);
      if (state.isPresent()) {
        return remember(rehydrate(state.get()));
      }
    }
    return null;
  }

  public Optional<A> findOptionalById(String id) {
    return Optional.ofNullable(findById(id));
  }

  public boolean exists(String id) {
    if (config.isEventStoreEnabled() && eventStore.readVersion(id) > 0) {
      return true;
    }
    return snapshotStore.get(id).isPresent();
  }

  /** Current version of the aggregate, 0 when it does not exist. */
  public long getVersion(String id) {
    if (config.isEventStoreEnabled()) {
      return eventStore.readVersion(id);
    }
    A aggregate = findById(id);
    return aggregate == null ? 0 : aggregate.getVersion();
  }

  /** Stored events in the inclusive range; empty when the event store is disabled. */
  public List<DomainEvent> getEvents(String id, Long fromVersion, Long toVersion) {
    if (!config.isEventStoreEnabled()) {
      return List.of();
    }
    return eventStore.readEvents(id, fromVersion, toVersion);
  }

  public List<DomainEvent> getEvents(String id) {
    if (!config.isEventStoreEnabled()) {
      return List.of();
    }
    return eventStore.readEvents(id);
  }

  public Optional<Snapshot> getSnapshot(String id) {
    return snapshotStore.get(id);
  }

  /**
   * Removes the aggregate's events, snapshot and cache entry.
   *
   * @throws EntityNotFoundException if the aggregate does not exist
   */
  public void delete(String id) {
    withRetry(
        "delete",
        id,
        () -> {
          if (!exists(id)) {
            throw new EntityNotFoundException(aggregateType, id);
          }
          eventStore.delete(id);
          snapshotStore.delete(id);
          cache.del(aggregateType, id);
          log.info("Deleted {} {}", aggregateType, id);
          return null;
        });
  }

  /**
   * Removes several aggregates. With a transactional event store and transactions enabled the
   * streams go in one transaction; otherwise each id is deleted on its own. Unknown ids are skipped
   * in the transactional path.
   */
  public void deleteAll(Collection<String> ids) {
    if (config.isTransactionEnabled() && eventStore instanceof TransactionalEventStore) {
      TransactionalEventStore transactional = (TransactionalEventStore) eventStore;
      withRetry(
          "deleteAll",
          ids.toString(),
          () -> {
            int removed = transactional.deleteAll(ids);
            for (String id : ids) {
              snapshotStore.delete(id);
              cache.del(aggregateType, id);
            }
            log.info("Deleted {} of {} {} aggregates", removed, ids.size(), aggregateType);
            return null;
          });
      return;
    }
    for (String id : ids) {
      delete(id);
    }
  }

  public String getAggregateType() {
    return aggregateType;
  }

  private A rehydrate(Snapshot snapshot) {
    A aggregate = factory.newInstance(snapshot.aggregateId());
    aggregate.restoreFrom(snapshot);
    return aggregate;
  }

  private A remember(A aggregate) {
    if (config.isCacheEnabled()) {
      cache.set(aggregateType, aggregate.getId(), aggregate.toSnapshot(), config.getCacheTtl());
    }
    return aggregate;
  }

  private <T> T withRetry(String operation, String id, Supplier<T> action) {
    int attempts = Math.max(1, config.getMaxRetries());
    for (int attempt = 1; ; attempt++) {
      try {
        return action.get();
      } catch (TransientException e) {
        if (attempt >= attempts) {
          log.error(
              "{} of {} {} failed after {} attempts", operation, aggregateType, id, attempt, e);
          throw e;
        }
        Duration delay = config.getRetryDelay().multipliedBy(attempt);
        log.warn(
            "{} of {} {} failed (attempt {}/{}), retrying in {}: {}",
            operation,
            aggregateType,
            id,
            attempt,
            attempts,
            delay,
            e.getMessage());
        pause(delay);
      }
    }
  }

  private static void pause(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Interrupted while waiting to retry", e);
    }
  }
}
