package com.acme.cqrs.aggregate;

import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.message.DomainEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Consistency boundary whose state is derived from its ordered events.
 *
 * <p>The version starts at 0 and grows by exactly one per event. New events go through {@link
 * #raise}; history goes through {@link #replay}. Subclasses mutate state only in {@link #apply}.
 */
public abstract class AggregateRoot {

  private final String id;
  private long version;
  private final List<DomainEvent> uncommittedEvents = new ArrayList<>();

  protected AggregateRoot(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Aggregate id is required");
    }
    this.id = id;
  }

  /** Applies one event to the in-memory state. Must not fail for a valid event. */
  protected abstract void apply(DomainEvent event);

  /** Serializable view of the current state, written to snapshots as JSON. */
  protected abstract Object captureState();

  /** Inverse of {@link #captureState()}. */
  protected abstract void restoreState(String stateJson);

  public String getAggregateType() {
    return getClass().getSimpleName();
  }

  /** Version the next raised event must carry. */
  protected long nextVersion() {
    return version + 1;
  }

  protected void raise(DomainEvent event) {
    checkSequence(event);
    apply(event);
    version = event.getAggregateVersion();
    uncommittedEvents.add(event);
  }

  public void replay(DomainEvent event) {
    checkSequence(event);
    apply(event);
    version = event.getAggregateVersion();
  }

  public void replay(List<? extends DomainEvent> events) {
    events.forEach(this::replay);
  }

  public Snapshot toSnapshot() {
    return new Snapshot(
        id, getAggregateType(), version, Jsons.toJson(captureState()), Instant.now());
  }

  public void restoreFrom(Snapshot snapshot) {
    if (!id.equals(snapshot.aggregateId())) {
      throw new IllegalArgumentException(
          "Snapshot of " + snapshot.aggregateId() + " cannot restore aggregate " + id);
    }
    restoreState(snapshot.state());
    version = snapshot.version();
    uncommittedEvents.clear();
  }

  private void checkSequence(DomainEvent event) {
    if (!id.equals(event.getAggregateId())) {
      throw new IllegalArgumentException(
          "Event for aggregate " + event.getAggregateId() + " applied to " + id);
    }
    if (event.getAggregateVersion() != version + 1) {
      throw new IllegalStateException(
          "Aggregate "
              + id
              + " at version "
              + version
              + " cannot apply event version "
              + event.getAggregateVersion());
    }
  }

  public String getId() {
    return id;
  }

  public long getVersion() {
    return version;
  }

  /** Version on record before the uncommitted events. */
  public long getCommittedVersion() {
    return version - uncommittedEvents.size();
  }

  public List<DomainEvent> getUncommittedEvents() {
    return List.copyOf(uncommittedEvents);
  }

  public boolean hasUncommittedEvents() {
    return !uncommittedEvents.isEmpty();
  }

  public void markEventsAsCommitted() {
    uncommittedEvents.clear();
  }
}
