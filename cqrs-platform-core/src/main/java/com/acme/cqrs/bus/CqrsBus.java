package com.acme.cqrs.bus;

import com.acme.cqrs.command.CommandBus;
import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.core.AlreadyInitializedException;
import com.acme.cqrs.core.NotInitializedException;
import com.acme.cqrs.core.UseCaseNotFoundException;
import com.acme.cqrs.event.EventBus;
import com.acme.cqrs.event.EventPublisher;
import com.acme.cqrs.message.Command;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.message.Query;
import com.acme.cqrs.projection.ProjectorManager;
import com.acme.cqrs.query.QueryBus;
import com.acme.cqrs.usecase.UseCase;
import com.acme.cqrs.usecase.UseCaseRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point over the command, query and event buses.
 *
 * <p>Every dispatch requires {@link #initialize()} first. Published events go through the event
 * bus and then to the projector manager; projection problems are logged, never thrown. As an
 * {@link EventPublisher} the facade is what repositories publish committed events through, so
 * each committed event reaches handlers and projectors exactly once.
 */
public class CqrsBus implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(CqrsBus.class);

  public enum State {
    UNINITIALIZED,
    INITIALIZED
  }

  private final CommandBus commandBus;
  private final QueryBus queryBus;
  private final EventBus eventBus;
  private final ProjectorManager projectorManager;
  private final UseCaseRegistry useCaseRegistry;
  private final CqrsConfig config;

  private volatile State state = State.UNINITIALIZED;

  public CqrsBus(
      CommandBus commandBus,
      QueryBus queryBus,
      EventBus eventBus,
      ProjectorManager projectorManager,
      UseCaseRegistry useCaseRegistry,
      CqrsConfig config) {
    this.commandBus = commandBus;
    this.queryBus = queryBus;
    this.eventBus = eventBus;
    this.projectorManager = projectorManager;
    this.useCaseRegistry = useCaseRegistry;
    this.config = config;
  }

  /**
   * Applies the bus configuration and opens the facade for dispatch.
   *
   * @throws AlreadyInitializedException if called twice without a shutdown in between
   */
  public synchronized void initialize() {
    if (state == State.INITIALIZED) {
      throw new AlreadyInitializedException("CQRS bus is already initialized");
    }
    if (config.isEnabled()) {
      commandBus.applyConfiguration(config);
      queryBus.applyConfiguration(config);
      eventBus.applyConfiguration(config);
    } else {
      log.warn("CQRS configuration disabled, buses keep their current settings");
    }
    state = State.INITIALIZED;
    log.info("CQRS bus initialized with {}", config);
  }

  /**
   * Clears every handler, subscription, middleware and cached query result, then returns to the
   * uninitialized state.
   */
  public synchronized void shutdown() {
    ensureInitialized();
    commandBus.clearHandlers();
    commandBus.clearMiddlewares();
    queryBus.clearHandlers();
    queryBus.clearMiddlewares();
    queryBus.clearCache();
    eventBus.clearHandlers();
    eventBus.clearSubscriptions();
    eventBus.clearMiddlewares();
    state = State.UNINITIALIZED;
    log.info("CQRS bus shut down");
  }

  public void executeCommand(Command command) {
    ensureInitialized();
    commandBus.execute(command);
  }

  public <R> R executeQuery(Query query) {
    ensureInitialized();
    return queryBus.execute(query);
  }

  public void publishEvent(DomainEvent event) {
    ensureInitialized();
    eventBus.publish(event);
    try {
      projectorManager.projectEvent(event);
    } catch (RuntimeException e) {
      log.error("Projection failed for event {} id={}", event.eventType(), event.getEventId(), e);
    }
  }

  public void publishEvents(List<? extends DomainEvent> events) {
    ensureInitialized();
    eventBus.publishAll(events);
    try {
      projectorManager.projectEvents(events);
    } catch (RuntimeException e) {
      log.error("Projection failed for a batch of {} events", events.size(), e);
    }
  }

  @Override
  public void publish(DomainEvent event) {
    publishEvent(event);
  }

  @Override
  public void publishAll(List<? extends DomainEvent> events) {
    publishEvents(events);
  }

  /**
   * Runs a registered use case.
   *
   * @throws UseCaseNotFoundException if no use case is registered under {@code useCaseName}
   */
  @SuppressWarnings("unchecked")
  public <I, O> O executeUseCase(String useCaseName, I request) {
    ensureInitialized();
    UseCase<I, O> useCase =
        (UseCase<I, O>)
            useCaseRegistry
                .get(useCaseName)
                .orElseThrow(() -> new UseCaseNotFoundException(useCaseName));
    O result = useCase.execute(request);
    log.debug("Use case {} executed", useCaseName);
    return result;
  }

  /** False when not initialized or a bus cannot accept work. Never throws. */
  public boolean healthCheck() {
    if (state != State.INITIALIZED) {
      return false;
    }
    try {
      return eventBus.isRunning();
    } catch (RuntimeException e) {
      log.warn("Health check failed", e);
      return false;
    }
  }

  public CqrsStatistics getStatistics() {
    return new CqrsStatistics(
        isInitialized(),
        commandBus.getHandlerCount(),
        commandBus.getMiddlewareCount(),
        queryBus.getHandlerCount(),
        queryBus.getMiddlewareCount(),
        queryBus.getCacheStats(),
        eventBus.getHandlerCount(),
        eventBus.getSubscriptionCount(),
        eventBus.getMiddlewareCount(),
        eventBus.getStats());
  }

  public boolean supportsCommand(String commandType) {
    return commandBus.supports(commandType);
  }

  public boolean supportsQuery(String queryType) {
    return queryBus.supports(queryType);
  }

  public boolean supportsEvent(String eventType) {
    return eventBus.supports(eventType);
  }

  public List<String> getSupportedCommandTypes() {
    return commandBus.getRegisteredTypes();
  }

  public List<String> getSupportedQueryTypes() {
    return queryBus.getRegisteredTypes();
  }

  public List<String> getSupportedEventTypes() {
    return eventBus.getRegisteredTypes();
  }

  public boolean isInitialized() {
    return state == State.INITIALIZED;
  }

  public State getState() {
    return state;
  }

  public CommandBus getCommandBus() {
    return commandBus;
  }

  public QueryBus getQueryBus() {
    return queryBus;
  }

  public EventBus getEventBus() {
    return eventBus;
  }

  public ProjectorManager getProjectorManager() {
    return projectorManager;
  }

  public UseCaseRegistry getUseCaseRegistry() {
    return useCaseRegistry;
  }

  private void ensureInitialized() {
    if (state != State.INITIALIZED) {
      throw new NotInitializedException("CQRS bus is not initialized");
    }
  }
}
