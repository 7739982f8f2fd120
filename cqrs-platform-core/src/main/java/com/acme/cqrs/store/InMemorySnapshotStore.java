package com.acme.cqrs.store;

import com.acme.cqrs.aggregate.Snapshot;
import com.acme.cqrs.spi.SnapshotStore;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotStore implements SnapshotStore {

  private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

  @Override
  public Optional<Snapshot> get(String aggregateId) {
    return Optional.ofNullable(snapshots.get(aggregateId));
  }

  @Override
  public void put(Snapshot snapshot) {
    snapshots.merge(
        snapshot.aggregateId(),
        snapshot,
        (existing, candidate) -> candidate.version() >= existing.version() ? candidate : existing);
  }

  @Override
  public boolean delete(String aggregateId) {
    return snapshots.remove(aggregateId) != null;
  }

  public int size() {
    return snapshots.size();
  }
}
