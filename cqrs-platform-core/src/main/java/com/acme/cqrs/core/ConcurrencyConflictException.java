package com.acme.cqrs.core;

/**
 * Optimistic concurrency failure: the version the writer based its changes on is not the version
 * on record. The caller has to reload the aggregate and re-apply its command.
 */
public class ConcurrencyConflictException extends PermanentException {
  private final String aggregateId;
  private final long expectedVersion;
  private final long actualVersion;

  public ConcurrencyConflictException(
      String aggregateId, long expectedVersion, long actualVersion) {
    super(
        String.format(
            "Concurrency conflict on aggregate %s: expected version %d but store holds %d",
            aggregateId, expectedVersion, actualVersion));
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public ConcurrencyConflictException(String aggregateId, long expectedVersion, Throwable cause) {
    super(
        String.format(
            "Concurrency conflict on aggregate %s: version %d was written concurrently",
            aggregateId, expectedVersion + 1),
        cause);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = -1;
  }

  public String getAggregateId() {
    return aggregateId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /** Version found in the store, or -1 when the conflict was detected by a constraint. */
  public long getActualVersion() {
    return actualVersion;
  }
}
