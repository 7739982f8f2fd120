package com.acme.cqrs.spi;

import com.acme.cqrs.aggregate.Snapshot;
import java.util.Optional;

/** Holds the latest snapshot per aggregate. */
public interface SnapshotStore {

  Optional<Snapshot> get(String aggregateId);

  /** Stores the snapshot unless a newer one is already present. */
  void put(Snapshot snapshot);

  boolean delete(String aggregateId);
}
