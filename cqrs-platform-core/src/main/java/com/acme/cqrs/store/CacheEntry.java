package com.acme.cqrs.store;

import java.time.Instant;

/** Cached value with an absolute expiry. */
public record CacheEntry(Object value, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
