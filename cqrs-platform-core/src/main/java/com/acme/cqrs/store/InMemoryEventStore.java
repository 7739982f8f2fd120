package com.acme.cqrs.store;

import com.acme.cqrs.core.ConcurrencyConflictException;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.spi.TransactionalEventStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Event streams held in memory; every operation runs under the store's monitor. */
public class InMemoryEventStore implements TransactionalEventStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final Map<String, List<DomainEvent>> streams = new HashMap<>();

  @Override
  public synchronized void append(
      String aggregateId, long expectedVersion, List<? extends DomainEvent> events) {
    if (events.isEmpty()) {
      return;
    }
    long current = versionOf(aggregateId);
    long expected =
        expectedVersion == ANY_VERSION ? events.get(0).getAggregateVersion() - 1 : expectedVersion;
    if (current != expected) {
      throw new ConcurrencyConflictException(aggregateId, expected, current);
    }
    long next = current + 1;
    for (DomainEvent event : events) {
      if (event.getAggregateVersion() != next) {
        throw new ConcurrencyConflictException(aggregateId, next - 1, current);
      }
      next++;
    }
    streams.computeIfAbsent(aggregateId, id -> new ArrayList<>()).addAll(events);
    log.debug("Appended {} events to {} (now at version {})", events.size(), aggregateId, next - 1);
  }

  @Override
  public synchronized List<DomainEvent> readEvents(
      String aggregateId, Long fromVersion, Long toVersion) {
    List<DomainEvent> result = new ArrayList<>();
    for (DomainEvent event : streams.getOrDefault(aggregateId, List.of())) {
      long version = event.getAggregateVersion();
      if ((fromVersion == null || version >= fromVersion)
          && (toVersion == null || version <= toVersion)) {
        result.add(event);
      }
    }
    return result;
  }

  @Override
  public synchronized long readVersion(String aggregateId) {
    return versionOf(aggregateId);
  }

  @Override
  public synchronized boolean delete(String aggregateId) {
    return streams.remove(aggregateId) != null;
  }

  @Override
  public synchronized int deleteAll(Collection<String> aggregateIds) {
    int removed = 0;
    for (String aggregateId : aggregateIds) {
      if (streams.remove(aggregateId) != null) {
        removed++;
      }
    }
    return removed;
  }

  private long versionOf(String aggregateId) {
    List<DomainEvent> stream = streams.get(aggregateId);
    if (stream == null || stream.isEmpty()) {
      return 0;
    }
    return stream.get(stream.size() - 1).getAggregateVersion();
  }
}
