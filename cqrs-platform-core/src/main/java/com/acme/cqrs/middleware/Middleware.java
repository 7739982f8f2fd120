package com.acme.cqrs.middleware;

import com.acme.cqrs.message.MessageContext;
import java.util.function.Supplier;

/**
 * Interceptor around a bus operation. Implementations call {@code next.get()} to continue the
 * chain, may skip it to short-circuit, and may throw to abort the remaining chain.
 */
public interface Middleware {

  /** Unique within a chain; adding a middleware with an existing name replaces it in place. */
  String getName();

  /** Lower runs first (outermost). */
  int getPriority();

  Object execute(MessageContext context, Supplier<Object> next);
}
