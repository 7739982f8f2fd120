package com.acme.cqrs.config;

import java.time.Duration;

/**
 * Settings of an aggregate repository. Pure POJO - no framework dependencies.
 *
 * <p>With {@code eventStoreEnabled} the repository is event sourced and snapshots every {@code
 * snapshotInterval} versions. Without it the snapshot store holds the materialized state and is
 * rewritten on every save.
 */
public class RepositoryConfig {

  private boolean cacheEnabled = true;
  private Duration cacheTtl = Duration.ofMinutes(5);
  private boolean transactionEnabled = true;
  private boolean optimisticLockingEnabled = true;
  private int maxRetries = 3;
  private Duration retryDelay = Duration.ofSeconds(1); // multiplied by the attempt number
  private boolean eventStoreEnabled = true;
  private boolean snapshotEnabled = true;
  private int snapshotInterval = 10;
  private boolean eventPublishingEnabled = true;

  public boolean isCacheEnabled() {
    return cacheEnabled;
  }

  public void setCacheEnabled(boolean cacheEnabled) {
    this.cacheEnabled = cacheEnabled;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public void setCacheTtl(Duration cacheTtl) {
    this.cacheTtl = cacheTtl;
  }

  public boolean isTransactionEnabled() {
    return transactionEnabled;
  }

  public void setTransactionEnabled(boolean transactionEnabled) {
    this.transactionEnabled = transactionEnabled;
  }

  public boolean isOptimisticLockingEnabled() {
    return optimisticLockingEnabled;
  }

  public void setOptimisticLockingEnabled(boolean optimisticLockingEnabled) {
    this.optimisticLockingEnabled = optimisticLockingEnabled;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
    }
    this.maxRetries = maxRetries;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }

  public boolean isEventStoreEnabled() {
    return eventStoreEnabled;
  }

  public void setEventStoreEnabled(boolean eventStoreEnabled) {
    this.eventStoreEnabled = eventStoreEnabled;
  }

  public boolean isSnapshotEnabled() {
    return snapshotEnabled;
  }

  public void setSnapshotEnabled(boolean snapshotEnabled) {
    this.snapshotEnabled = snapshotEnabled;
  }

  public int getSnapshotInterval() {
    return snapshotInterval;
  }

  public void setSnapshotInterval(int snapshotInterval) {
    if (snapshotInterval < 1) {
      throw new IllegalArgumentException(
          "snapshotInterval must be at least 1: " + snapshotInterval);
    }
    this.snapshotInterval = snapshotInterval;
  }

  public boolean isEventPublishingEnabled() {
    return eventPublishingEnabled;
  }

  public void setEventPublishingEnabled(boolean eventPublishingEnabled) {
    this.eventPublishingEnabled = eventPublishingEnabled;
  }
}
