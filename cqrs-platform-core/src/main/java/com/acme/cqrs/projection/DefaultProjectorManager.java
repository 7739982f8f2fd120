package com.acme.cqrs.projection;

import com.acme.cqrs.message.DomainEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps projectors by name, runs every enabled projector interested in an event one after the
 * other and records per-projector execution statistics. A failing projector is logged and counted;
 * the remaining projectors still run.
 */
public class DefaultProjectorManager implements ProjectorManager {
  private static final Logger log = LoggerFactory.getLogger(DefaultProjectorManager.class);

  private final Map<String, Registration> projectors = new LinkedHashMap<>();

  @Override
  public synchronized void register(EventProjector<? extends DomainEvent> projector) {
    String name = projector.getProjectorName();
    if (projectors.containsKey(name)) {
      throw new IllegalStateException("Projector already registered: " + name);
    }
    projectors.put(name, new Registration(projector));
    log.info(
        "Registering projector {} for event types {}", name, projector.getProjectedEventTypes());
  }

  @Override
  public void projectEvent(DomainEvent event) {
    for (Registration registration : activeFor(event)) {
      registration.run(event);
    }
  }

  @Override
  public void projectEvents(List<? extends DomainEvent> events) {
    for (DomainEvent event : events) {
      try {
        projectEvent(event);
      } catch (RuntimeException e) {
        log.error("Projection of event {} failed", event.getEventId(), e);
      }
    }
  }

  /**
   * Replays {@code events} into every registered projector able to rebuild its read model. A
   * failing rebuild is logged and does not stop the others.
   */
  @Override
  @SuppressWarnings("unchecked")
  public void rebuildReadModel(String aggregateId, List<? extends DomainEvent> events) {
    for (Registration registration : snapshot()) {
      if (!(registration.projector instanceof ReadModelProjector)) {
        continue;
      }
      ReadModelProjector<DomainEvent> projector =
          (ReadModelProjector<DomainEvent>) registration.projector;
      try {
        projector.rebuildReadModel(aggregateId, (List<DomainEvent>) events);
        log.info(
            "Rebuilt {} read model for aggregate {} from {} events",
            projector.getReadModelType(),
            aggregateId,
            events.size());
      } catch (RuntimeException e) {
        log.error(
            "Rebuild of {} for aggregate {} failed", projector.getProjectorName(), aggregateId, e);
      }
    }
  }

  @Override
  public synchronized List<EventProjector<? extends DomainEvent>> getProjectors(String eventType) {
    List<EventProjector<? extends DomainEvent>> result = new ArrayList<>();
    for (Registration registration : projectors.values()) {
      if (registration.projector.getProjectedEventTypes().contains(eventType)) {
        result.add(registration.projector);
      }
    }
    return result;
  }

  @Override
  public synchronized List<EventProjector<? extends DomainEvent>> getAllProjectors() {
    List<EventProjector<? extends DomainEvent>> result = new ArrayList<>();
    projectors.values().forEach(registration -> result.add(registration.projector));
    return result;
  }

  @Override
  public synchronized boolean hasProjector(String projectorName) {
    return projectors.containsKey(projectorName);
  }

  @Override
  public synchronized void removeProjector(String projectorName) {
    if (projectors.remove(projectorName) != null) {
      log.info("Removed projector {}", projectorName);
    }
  }

  @Override
  public synchronized void clear() {
    projectors.clear();
  }

  public synchronized void enable(String projectorName) {
    require(projectorName).enabled = true;
  }

  public synchronized void disable(String projectorName) {
    require(projectorName).enabled = false;
    log.info("Disabled projector {}", projectorName);
  }

  public synchronized boolean isEnabled(String projectorName) {
    return require(projectorName).enabled;
  }

  public synchronized Optional<ProjectorStats> getStats(String projectorName) {
    Registration registration = projectors.get(projectorName);
    return registration == null ? Optional.empty() : Optional.of(registration.stats());
  }

  public synchronized List<ProjectorStats> getAllStats() {
    List<ProjectorStats> result = new ArrayList<>();
    projectors.values().forEach(registration -> result.add(registration.stats()));
    return result;
  }

  private Registration require(String projectorName) {
    Registration registration = projectors.get(projectorName);
    if (registration == null) {
      throw new IllegalArgumentException("Unknown projector: " + projectorName);
    }
    return registration;
  }

  private synchronized List<Registration> snapshot() {
    return new ArrayList<>(projectors.values());
  }

  private List<Registration> activeFor(DomainEvent event) {
    List<Registration> active = new ArrayList<>();
    for (Registration registration : snapshot()) {
      if (registration.enabled
          && registration.projector.getProjectedEventTypes().contains(event.eventType())) {
        active.add(registration);
      }
    }
    return active;
  }

  private static final class Registration {
    private final EventProjector<? extends DomainEvent> projector;
    private volatile boolean enabled = true;
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile String lastError;
    private volatile Instant lastExecutedAt;

    private Registration(EventProjector<? extends DomainEvent> projector) {
      this.projector = projector;
    }

    @SuppressWarnings("unchecked")
    private void run(DomainEvent event) {
      EventProjector<DomainEvent> target = (EventProjector<DomainEvent>) projector;
      if (!target.canProject(event)) {
        return;
      }
      executions.incrementAndGet();
      lastExecutedAt = Instant.now();
      try {
        target.project(event);
        successes.incrementAndGet();
      } catch (RuntimeException e) {
        failures.incrementAndGet();
        lastError = e.getMessage();
        log.error(
            "Projector {} failed on event {} id={}",
            target.getProjectorName(),
            event.eventType(),
            event.getEventId(),
            e);
      }
    }

    private ProjectorStats stats() {
      return new ProjectorStats(
          projector.getProjectorName(),
          enabled,
          executions.get(),
          successes.get(),
          failures.get(),
          lastError,
          lastExecutedAt);
    }
  }
}
