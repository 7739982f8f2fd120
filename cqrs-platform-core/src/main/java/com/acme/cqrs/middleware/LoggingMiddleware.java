package com.acme.cqrs.middleware;

import com.acme.cqrs.message.MessageContext;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Puts the message identity into the SLF4J MDC for the duration of the dispatch and logs entry,
 * exit and failures. Failures are rethrown unchanged.
 */
public class LoggingMiddleware implements Middleware {
  private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

  public static final String NAME = "logging";
  public static final String MDC_MESSAGE_ID = "messageId";
  public static final String MDC_MESSAGE_TYPE = "messageType";
  public static final String MDC_TENANT_ID = "tenantId";
  public static final String MDC_USER_ID = "userId";

  private final int priority;

  public LoggingMiddleware() {
    this(0);
  }

  public LoggingMiddleware(int priority) {
    this.priority = priority;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public int getPriority() {
    return priority;
  }

  @Override
  public Object execute(MessageContext context, Supplier<Object> next) {
    try (MDC.MDCCloseable ignoredId = MDC.putCloseable(MDC_MESSAGE_ID, context.messageId());
        MDC.MDCCloseable ignoredType = MDC.putCloseable(MDC_MESSAGE_TYPE, context.messageType());
        MDC.MDCCloseable ignoredTenant = MDC.putCloseable(MDC_TENANT_ID, context.tenantId());
        MDC.MDCCloseable ignoredUser = MDC.putCloseable(MDC_USER_ID, context.userId())) {
      long start = System.nanoTime();
      log.debug("Dispatching {} id={}", context.messageType(), context.messageId());
      try {
        Object result = next.get();
        log.debug(
            "Dispatched {} id={} in {}ms",
            context.messageType(),
            context.messageId(),
            (System.nanoTime() - start) / 1_000_000);
        return result;
      } catch (RuntimeException e) {
        log.error(
            "Dispatch failed: {} id={}: {}",
            context.messageType(),
            context.messageId(),
            e.getMessage());
        throw e;
      }
    }
  }
}
