package com.acme.cqrs.query;

public record QueryCacheStats(
    int totalEntries, int activeEntries, int expiredEntries, long hits, long misses) {

  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
