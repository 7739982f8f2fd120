package com.acme.cqrs.runtime;

import com.acme.cqrs.bus.CqrsBus;
import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.config.RepositoryConfig;
import io.micronaut.context.event.ShutdownEvent;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the {@link CqrsBus} once the application context has started and clears it on shutdown.
 * The effective configuration is logged once at startup.
 */
@Singleton
public class CqrsLifecycle {
  private static final Logger log = LoggerFactory.getLogger(CqrsLifecycle.class);

  private final CqrsBus cqrsBus;
  private final CqrsConfig cqrsConfig;
  private final RepositoryConfig repositoryConfig;

  public CqrsLifecycle(CqrsBus cqrsBus, CqrsConfig cqrsConfig, RepositoryConfig repositoryConfig) {
    this.cqrsBus = cqrsBus;
    this.cqrsConfig = cqrsConfig;
    this.repositoryConfig = repositoryConfig;
  }

  @EventListener
  public void onStartup(StartupEvent event) {
    logConfiguration();
    if (!cqrsBus.isInitialized()) {
      cqrsBus.initialize();
    }
  }

  @EventListener
  public void onShutdown(ShutdownEvent event) {
    if (cqrsBus.isInitialized()) {
      cqrsBus.shutdown();
    }
  }

  void logConfiguration() {
    log.info("━━━ CQRS Configuration ━━━");
    log.info("  Enabled:            {}", cqrsConfig.isEnabled());
    log.info("  Command Timeout:    {} (0s disables the deadline)", cqrsConfig.getCommandTimeout());
    log.info("  Query Timeout:      {} (0s disables the deadline)", cqrsConfig.getQueryTimeout());
    log.info(
        "  Query Cache:        {} (max TTL {})",
        cqrsConfig.isQueryCacheEnabled() ? "ENABLED" : "DISABLED",
        cqrsConfig.getQueryCacheMaxTtl());
    log.info("  Handler Timeout:    {} (per event handler)", cqrsConfig.getEventHandlerTimeout());
    log.info("  Max Concurrency:    {} (event dispatch threads)", cqrsConfig.getMaxConcurrency());
    log.info("━━━ Repository Configuration ━━━");
    log.info(
        "  Event Store:        {}", repositoryConfig.isEventStoreEnabled() ? "ENABLED" : "DISABLED");
    log.info(
        "  Snapshots:          {} (every {} versions)",
        repositoryConfig.isSnapshotEnabled() ? "ENABLED" : "DISABLED",
        repositoryConfig.getSnapshotInterval());
    log.info(
        "  Cache:              {} (TTL {})",
        repositoryConfig.isCacheEnabled() ? "ENABLED" : "DISABLED",
        repositoryConfig.getCacheTtl());
    log.info(
        "  Retries:            {} attempts, base delay {}",
        repositoryConfig.getMaxRetries(),
        repositoryConfig.getRetryDelay());
    log.info("  Optimistic Locking: {}", repositoryConfig.isOptimisticLockingEnabled());
  }
}
