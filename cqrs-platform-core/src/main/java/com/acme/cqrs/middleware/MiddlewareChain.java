package com.acme.cqrs.middleware;

import com.acme.cqrs.message.MessageContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of named middlewares shared by one bus. Kept sorted by ascending priority after
 * every mutation; the sort is stable so equal priorities keep insertion order.
 */
public class MiddlewareChain {
  private static final Logger log = LoggerFactory.getLogger(MiddlewareChain.class);

  private final String busName;
  private final List<Middleware> middlewares = new ArrayList<>();

  public MiddlewareChain(String busName) {
    this.busName = busName;
  }

  public synchronized void add(Middleware middleware) {
    int existing = indexOf(middleware.getName());
    if (existing >= 0) {
      log.info("Replacing middleware {} on {}", middleware.getName(), busName);
      middlewares.set(existing, middleware);
    } else {
      log.info(
          "Adding middleware {} (priority {}) to {}",
          middleware.getName(),
          middleware.getPriority(),
          busName);
      middlewares.add(middleware);
    }
    middlewares.sort(Comparator.comparingInt(Middleware::getPriority));
  }

  public synchronized boolean remove(String name) {
    int index = indexOf(name);
    if (index < 0) {
      return false;
    }
    middlewares.remove(index);
    return true;
  }

  public synchronized void clear() {
    middlewares.clear();
  }

  public synchronized List<Middleware> getMiddlewares() {
    return List.copyOf(middlewares);
  }

  public synchronized int size() {
    return middlewares.size();
  }

  /**
   * Runs {@code terminal} wrapped by every middleware. Middleware {@code i} receives a
   * continuation invoking middleware {@code i + 1}; the last one's continuation is the terminal.
   * The list is snapshotted first, so concurrent mutations do not affect a running dispatch.
   */
  public Object run(MessageContext context, Supplier<Object> terminal) {
    List<Middleware> snapshot = getMiddlewares();
    return proceed(snapshot, 0, context, terminal);
  }

  private Object proceed(
      List<Middleware> snapshot, int index, MessageContext context, Supplier<Object> terminal) {
    if (index >= snapshot.size()) {
      return terminal.get();
    }
    Middleware current = snapshot.get(index);
    return current.execute(context, () -> proceed(snapshot, index + 1, context, terminal));
  }

  private int indexOf(String name) {
    for (int i = 0; i < middlewares.size(); i++) {
      if (middlewares.get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }
}
