package com.acme.cqrs.aggregate;

/** Creates an empty aggregate at version 0, ready for replay or snapshot restore. */
@FunctionalInterface
public interface AggregateFactory<A extends AggregateRoot> {
  A newInstance(String aggregateId);
}
