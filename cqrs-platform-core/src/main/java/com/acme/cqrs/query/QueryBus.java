package com.acme.cqrs.query;

import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.core.DeadlineExceededException;
import com.acme.cqrs.core.DuplicateHandlerException;
import com.acme.cqrs.core.HandlerNotFoundException;
import com.acme.cqrs.core.HandlerRejectedException;
import com.acme.cqrs.core.UnsupportedTypeException;
import com.acme.cqrs.message.MessageContext;
import com.acme.cqrs.message.Query;
import com.acme.cqrs.middleware.Middleware;
import com.acme.cqrs.middleware.MiddlewareChain;
import com.acme.cqrs.store.CacheEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each query to its single handler and keeps a time-bounded result cache keyed by the
 * handler's cache key. Expired entries are evicted lazily on lookup or by {@link
 * #clearExpiredCache()}; there is no size bound.
 */
public class QueryBus {
  private static final Logger log = LoggerFactory.getLogger(QueryBus.class);

  private final Map<String, QueryHandler<? extends Query, ?>> handlers = new ConcurrentHashMap<>();
  private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
  private final MiddlewareChain middlewares = new MiddlewareChain("QueryBus");
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  private volatile Duration timeout;
  private volatile boolean cacheEnabled;
  private volatile Duration maxCacheTtl;

  public QueryBus() {
    this(new CqrsConfig());
  }

  public QueryBus(CqrsConfig config) {
    applyConfiguration(config);
  }

  public void applyConfiguration(CqrsConfig config) {
    this.timeout = config.getQueryTimeout();
    this.cacheEnabled = config.isQueryCacheEnabled();
    this.maxCacheTtl = config.getQueryCacheMaxTtl();
  }

  public void registerHandler(String queryType, QueryHandler<? extends Query, ?> handler) {
    if (handlers.containsKey(queryType)) {
      log.error("Handler already registered for query type: {}", queryType);
      throw new DuplicateHandlerException(queryType);
    }
    if (!handler.supports(queryType)) {
      throw new UnsupportedTypeException(queryType);
    }
    if (handlers.putIfAbsent(queryType, handler) != null) {
      throw new DuplicateHandlerException(queryType);
    }
    log.info("Registering handler for query type: {}", queryType);
  }

  /** Removes the handler and every cached result whose key starts with the query type. */
  public void unregisterHandler(String queryType) {
    if (handlers.remove(queryType) != null) {
      log.info("Unregistered handler for query type: {}", queryType);
    }
    cache.keySet().removeIf(key -> key.startsWith(queryType));
  }

  /**
   * Execute a query. A cached, unexpired result for the handler's cache key is returned as is
   * without invoking the handler.
   *
   * @throws HandlerNotFoundException if no handler is registered for the query type
   * @throws HandlerRejectedException if the handler's {@code canHandle} returns false
   */
  @SuppressWarnings("unchecked")
  public <R> R execute(Query query) {
    String queryType = query.queryType();
    QueryHandler<Query, Object> handler = lookup(queryType);
    MessageContext context = MessageContext.of(query, timeout);
    log.debug("Executing query: {} id={}", queryType, query.getMessageId());

    return (R) middlewares.run(context, () -> invoke(handler, query, context));
  }

  private Object invoke(QueryHandler<Query, Object> handler, Query query, MessageContext context) {
    String cacheKey = cacheEnabled ? handler.generateCacheKey(query) : null;
    if (cacheKey != null) {
      Object cached = lookupCache(cacheKey);
      if (cached != null) {
        log.debug("Cache hit for query: {}", cacheKey);
        return cached;
      }
    }

    if (context.isExpired()) {
      throw new DeadlineExceededException(
          "Deadline exceeded before handling query: " + query.queryType());
    }
    handler.validateQuery(query);
    if (!handler.canHandle(query)) {
      throw new HandlerRejectedException("Handler cannot process query: " + query.queryType());
    }
    Object result = handler.execute(query);

    if (cacheKey != null && result != null) {
      Duration expiration = effectiveExpiration(handler.getCacheExpiration(query));
      if (!expiration.isZero()) {
        cache.put(cacheKey, new CacheEntry(result, Instant.now().plus(expiration)));
      }
    }
    return result;
  }

  private Object lookupCache(String cacheKey) {
    CacheEntry entry = cache.get(cacheKey);
    if (entry == null) {
      misses.incrementAndGet();
      return null;
    }
    if (entry.isExpired(Instant.now())) {
      cache.remove(cacheKey, entry);
      misses.incrementAndGet();
      return null;
    }
    hits.incrementAndGet();
    return entry.value();
  }

  private Duration effectiveExpiration(Duration requested) {
    if (requested == null || requested.isNegative() || requested.isZero()) {
      return Duration.ZERO;
    }
    Duration cap = maxCacheTtl;
    if (cap != null && !cap.isZero() && !cap.isNegative() && requested.compareTo(cap) > 0) {
      return cap;
    }
    return requested;
  }

  @SuppressWarnings("unchecked")
  private QueryHandler<Query, Object> lookup(String queryType) {
    QueryHandler<? extends Query, ?> handler = handlers.get(queryType);
    if (handler == null) {
      log.error("No handler registered for query type: {}", queryType);
      throw new HandlerNotFoundException(queryType);
    }
    return (QueryHandler<Query, Object>) handler;
  }

  public void clearCache() {
    cache.clear();
  }

  /** Drops every expired entry; returns how many were removed. */
  public int clearExpiredCache() {
    Instant now = Instant.now();
    int before = cache.size();
    cache.values().removeIf(entry -> entry.isExpired(now));
    int removed = before - cache.size();
    if (removed > 0) {
      log.debug("Evicted {} expired query results", removed);
    }
    return Math.max(removed, 0);
  }

  public QueryCacheStats getCacheStats() {
    Instant now = Instant.now();
    int total = 0;
    int expired = 0;
    for (CacheEntry entry : cache.values()) {
      total++;
      if (entry.isExpired(now)) {
        expired++;
      }
    }
    return new QueryCacheStats(total, total - expired, expired, hits.get(), misses.get());
  }

  public Optional<QueryHandler<? extends Query, ?>> getHandler(String queryType) {
    return Optional.ofNullable(handlers.get(queryType));
  }

  public boolean supports(String queryType) {
    return handlers.containsKey(queryType);
  }

  public List<String> getRegisteredTypes() {
    return List.copyOf(handlers.keySet());
  }

  public int getHandlerCount() {
    return handlers.size();
  }

  public void addMiddleware(Middleware middleware) {
    middlewares.add(middleware);
  }

  public void removeMiddleware(String name) {
    middlewares.remove(name);
  }

  public List<Middleware> getMiddlewares() {
    return middlewares.getMiddlewares();
  }

  public int getMiddlewareCount() {
    return middlewares.size();
  }

  public void clearHandlers() {
    handlers.clear();
  }

  public void clearMiddlewares() {
    middlewares.clear();
  }
}
