package com.acme.cqrs.bus;

import com.acme.cqrs.event.EventBusStats;
import com.acme.cqrs.query.QueryCacheStats;

/** Point-in-time counts across the three buses. */
public record CqrsStatistics(
    boolean initialized,
    int commandHandlers,
    int commandMiddlewares,
    int queryHandlers,
    int queryMiddlewares,
    QueryCacheStats queryCache,
    int eventHandlers,
    int eventSubscriptions,
    int eventMiddlewares,
    EventBusStats events) {

  public int totalHandlers() {
    return commandHandlers + queryHandlers + eventHandlers;
  }

  public int totalMiddlewares() {
    return commandMiddlewares + queryMiddlewares + eventMiddlewares;
  }
}
