package com.acme.cqrs.spi;

import java.time.Duration;
import java.util.Optional;

/** Namespaced key/value cache with per-entry time to live. */
public interface Cache {

  Optional<Object> get(String namespace, String key);

  /** A non-positive {@code ttl} removes the key instead of storing the value. */
  void set(String namespace, String key, Object value, Duration ttl);

  boolean del(String namespace, String key);
}
