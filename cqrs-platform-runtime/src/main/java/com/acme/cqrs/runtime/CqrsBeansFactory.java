package com.acme.cqrs.runtime;

import com.acme.cqrs.bus.CqrsBus;
import com.acme.cqrs.command.CommandBus;
import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.config.RepositoryConfig;
import com.acme.cqrs.event.EventBus;
import com.acme.cqrs.projection.DefaultProjectorManager;
import com.acme.cqrs.query.QueryBus;
import com.acme.cqrs.spi.EventStore;
import com.acme.cqrs.spi.SnapshotStore;
import com.acme.cqrs.store.InMemoryCache;
import com.acme.cqrs.store.InMemoryEventStore;
import com.acme.cqrs.store.InMemorySnapshotStore;
import com.acme.cqrs.usecase.InMemoryUseCaseRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Creates the core CQRS beans.
 *
 * <p>The core module has no framework dependency; this factory is the only place the POJOs meet
 * Micronaut's dependency injection. Without a {@code db.dialect} the event and snapshot stores are
 * the in-memory ones; with it the JDBC dialect beans take over.
 */
@Factory
public class CqrsBeansFactory {

  /** Creates CqrsConfig populated from application.yml cqrs.* properties */
  @Singleton
  @ConfigurationProperties("cqrs")
  public CqrsConfig cqrsConfig() {
    return new CqrsConfig();
  }

  /** Creates RepositoryConfig populated from application.yml cqrs.repository.* properties */
  @Singleton
  @ConfigurationProperties("cqrs.repository")
  public RepositoryConfig repositoryConfig() {
    return new RepositoryConfig();
  }

  @Singleton
  public CommandBus commandBus(CqrsConfig config) {
    return new CommandBus(config);
  }

  @Singleton
  public QueryBus queryBus(CqrsConfig config) {
    return new QueryBus(config);
  }

  @Singleton
  @Bean(preDestroy = "close")
  public EventBus eventBus(CqrsConfig config) {
    return new EventBus(config);
  }

  @Singleton
  public DefaultProjectorManager projectorManager() {
    return new DefaultProjectorManager();
  }

  @Singleton
  public InMemoryUseCaseRegistry useCaseRegistry() {
    return new InMemoryUseCaseRegistry();
  }

  @Singleton
  public InMemoryCache cache() {
    return new InMemoryCache();
  }

  @Singleton
  @Requires(missingProperty = "db.dialect")
  public EventStore inMemoryEventStore() {
    return new InMemoryEventStore();
  }

  @Singleton
  @Requires(missingProperty = "db.dialect")
  public SnapshotStore inMemorySnapshotStore() {
    return new InMemorySnapshotStore();
  }

  /** Creates the facade; {@link CqrsLifecycle} initializes it once the context has started. */
  @Singleton
  public CqrsBus cqrsBus(
      CommandBus commandBus,
      QueryBus queryBus,
      EventBus eventBus,
      DefaultProjectorManager projectorManager,
      InMemoryUseCaseRegistry useCaseRegistry,
      CqrsConfig config) {
    return new CqrsBus(commandBus, queryBus, eventBus, projectorManager, useCaseRegistry, config);
  }
}
