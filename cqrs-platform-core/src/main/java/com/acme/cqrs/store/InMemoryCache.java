package com.acme.cqrs.store;

import com.acme.cqrs.spi.Cache;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link Cache}. Expired entries are dropped when read or by {@link
 * #evictExpired()}; nothing runs in the background.
 */
public class InMemoryCache implements Cache {

  private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  @Override
  public Optional<Object> get(String namespace, String key) {
    String cacheKey = key(namespace, key);
    CacheEntry entry = entries.get(cacheKey);
    if (entry == null) {
      misses.incrementAndGet();
      return Optional.empty();
    }
    if (entry.isExpired(Instant.now())) {
      entries.remove(cacheKey, entry);
      misses.incrementAndGet();
      return Optional.empty();
    }
    hits.incrementAndGet();
    return Optional.of(entry.value());
  }

  @Override
  public void set(String namespace, String key, Object value, Duration ttl) {
    String cacheKey = key(namespace, key);
    if (ttl == null || ttl.isZero() || ttl.isNegative() || value == null) {
      entries.remove(cacheKey);
      return;
    }
    entries.put(cacheKey, new CacheEntry(value, Instant.now().plus(ttl)));
  }

  @Override
  public boolean del(String namespace, String key) {
    return entries.remove(key(namespace, key)) != null;
  }

  public int evictExpired() {
    Instant now = Instant.now();
    int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return Math.max(before - entries.size(), 0);
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
  }

  public long getHits() {
    return hits.get();
  }

  public long getMisses() {
    return misses.get();
  }

  private static String key(String namespace, String key) {
    return namespace + ":" + key;
  }
}
