package com.acme.cqrs.spi;

import com.acme.cqrs.message.DomainEvent;
import java.util.List;

/**
 * Append-only per-aggregate event streams. Versions in a stream start at 1 and have no gaps.
 */
public interface EventStore {

  /** Expected version meaning "whatever the stream holds"; the events must still be contiguous. */
  long ANY_VERSION = -1;

  /**
   * Appends {@code events} atomically.
   *
   * @throws com.acme.cqrs.core.ConcurrencyConflictException if the stream is not at {@code
   *     expectedVersion} or another writer appended the same versions concurrently
   */
  void append(String aggregateId, long expectedVersion, List<? extends DomainEvent> events);

  /** Events with {@code fromVersion <= version <= toVersion}; null bounds are open. */
  List<DomainEvent> readEvents(String aggregateId, Long fromVersion, Long toVersion);

  default List<DomainEvent> readEvents(String aggregateId) {
    return readEvents(aggregateId, null, null);
  }

  /** Version of the last event, 0 for an unknown stream. */
  long readVersion(String aggregateId);

  /** Removes the whole stream; false when there was none. */
  boolean delete(String aggregateId);
}
