package com.acme.cqrs.query;

import com.acme.cqrs.message.Query;
import java.time.Duration;

/**
 * Handles one query type and declares the caching policy for its results.
 *
 * @param <Q> query type
 * @param <R> result type
 */
public interface QueryHandler<Q extends Query, R> {

  /** Runs the read. A null result reaches the caller as is and is never cached. */
  R execute(Q query);

  boolean supports(String queryType);

  default void validateQuery(Q query) {}

  default boolean canHandle(Q query) {
    return true;
  }

  default int getPriority() {
    return 0;
  }

  /**
   * Key identifying equivalent queries. Must start with the query type so unregistering the
   * handler can drop its entries. Handlers with criteria fields should append them.
   */
  default String generateCacheKey(Q query) {
    return query.queryType()
        + ":"
        + query.getTenantId()
        + ":"
        + query.getUserId()
        + ":"
        + query.getQueryVersion()
        + ":"
        + query.getPage()
        + ":"
        + query.getPageSize()
        + ":"
        + query.getSortRules();
  }

  /** How long a result stays cached; {@link Duration#ZERO} disables caching for this query. */
  default Duration getCacheExpiration(Q query) {
    return Duration.ZERO;
  }
}
