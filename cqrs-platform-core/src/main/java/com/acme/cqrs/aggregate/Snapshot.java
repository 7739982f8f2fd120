package com.acme.cqrs.aggregate;

import java.time.Instant;

/**
 * Serialized aggregate state at {@code version}. {@code state} is the JSON produced by the
 * aggregate's {@code captureState()}.
 */
public record Snapshot(
    String aggregateId, String aggregateType, long version, String state, Instant createdAt) {

  public Snapshot {
    if (version < 0) {
      throw new IllegalArgumentException("Snapshot version must not be negative: " + version);
    }
  }
}
