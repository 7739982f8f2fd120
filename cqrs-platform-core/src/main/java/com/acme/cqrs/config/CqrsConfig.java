package com.acme.cqrs.config;

import java.time.Duration;

/**
 * Bus-level settings: dispatch deadlines, query cache policy and event fan-out concurrency. Pure
 * POJO - no framework dependencies.
 */
public class CqrsConfig {

  private boolean enabled = true;
  private Duration commandTimeout = Duration.ofSeconds(30);
  private Duration queryTimeout = Duration.ofSeconds(30);
  private boolean queryCacheEnabled = true;
  private Duration queryCacheMaxTtl = Duration.ofMinutes(5); // caps handler-supplied expirations
  private Duration eventHandlerTimeout = Duration.ofSeconds(30);
  private int maxConcurrency = 10;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getCommandTimeout() {
    return commandTimeout;
  }

  public void setCommandTimeout(Duration commandTimeout) {
    this.commandTimeout = commandTimeout;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  public boolean isQueryCacheEnabled() {
    return queryCacheEnabled;
  }

  public void setQueryCacheEnabled(boolean queryCacheEnabled) {
    this.queryCacheEnabled = queryCacheEnabled;
  }

  public Duration getQueryCacheMaxTtl() {
    return queryCacheMaxTtl;
  }

  public void setQueryCacheMaxTtl(Duration queryCacheMaxTtl) {
    this.queryCacheMaxTtl = queryCacheMaxTtl;
  }

  public Duration getEventHandlerTimeout() {
    return eventHandlerTimeout;
  }

  public void setEventHandlerTimeout(Duration eventHandlerTimeout) {
    this.eventHandlerTimeout = eventHandlerTimeout;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(int maxConcurrency) {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be at least 1: " + maxConcurrency);
    }
    this.maxConcurrency = maxConcurrency;
  }

  @Override
  public String toString() {
    return "CqrsConfig{enabled="
        + enabled
        + ", commandTimeout="
        + commandTimeout
        + ", queryTimeout="
        + queryTimeout
        + ", queryCacheEnabled="
        + queryCacheEnabled
        + ", queryCacheMaxTtl="
        + queryCacheMaxTtl
        + ", eventHandlerTimeout="
        + eventHandlerTimeout
        + ", maxConcurrency="
        + maxConcurrency
        + '}';
  }
}
