package com.acme.cqrs.event;

import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.core.DeadlineExceededException;
import com.acme.cqrs.core.TransientException;
import com.acme.cqrs.core.UnsupportedTypeException;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.message.MessageContext;
import com.acme.cqrs.middleware.Middleware;
import com.acme.cqrs.middleware.MiddlewareChain;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans each published event out to every registered handler and subscription for its type.
 *
 * <p>Deliveries for one event start together on the dispatch pool and {@link #publish} returns
 * once all of them finished. A failing delivery is logged and reported to the handler's {@link
 * EventHandler#handleFailure}; it never reaches the publisher or the other deliveries. The pool
 * parallelism is {@link CqrsConfig#getMaxConcurrency()}; each delivery, retries included, is
 * bounded by {@link CqrsConfig#getEventHandlerTimeout()}. A delivery past its deadline makes no
 * further attempts and does not mark the event as processed.
 */
public class EventBus implements EventPublisher, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  private final Map<String, List<EventHandler<? extends DomainEvent>>> handlers =
      new ConcurrentHashMap<>();
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final MiddlewareChain middlewares = new MiddlewareChain("EventBus");
  private final AtomicLong subscriptionIds = new AtomicLong();

  private final AtomicLong published = new AtomicLong();
  private final AtomicLong succeeded = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();

  private volatile ForkJoinPool pool;
  private volatile Duration handlerTimeout;

  public EventBus() {
    this(new CqrsConfig());
  }

  public EventBus(CqrsConfig config) {
    applyConfiguration(config);
  }

  public synchronized void applyConfiguration(CqrsConfig config) {
    this.handlerTimeout = config.getEventHandlerTimeout();
    ForkJoinPool current = this.pool;
    if (current == null || current.getParallelism() != config.getMaxConcurrency()) {
      this.pool =
          new ForkJoinPool(
              config.getMaxConcurrency(),
              ForkJoinPool.defaultForkJoinWorkerThreadFactory,
              null,
              true);
      if (current != null) {
        current.shutdown();
      }
      log.info("Event dispatch pool parallelism: {}", config.getMaxConcurrency());
    }
  }

  @Override
  public void publish(DomainEvent event) {
    published.incrementAndGet();
    MessageContext context = MessageContext.of(event, null);
    middlewares.run(
        context,
        () -> {
          dispatch(event);
          return null;
        });
  }

  /** Publishes every event concurrently and returns when all of them were delivered. */
  @Override
  public void publishAll(List<? extends DomainEvent> events) {
    if (events.isEmpty()) {
      return;
    }
    ForkJoinPool executor = pool;
    CompletableFuture<?>[] futures =
        events.stream()
            .map(event -> CompletableFuture.runAsync(() -> publish(event), executor))
            .toArray(CompletableFuture[]::new);
    try {
      CompletableFuture.allOf(futures).join();
    } catch (CompletionException e) {
      throw unwrap(e);
    }
  }

  /** Adds a handler for the type; several handlers per type are allowed. */
  public void registerHandler(String eventType, EventHandler<? extends DomainEvent> handler) {
    if (!handler.supports(eventType)) {
      throw new UnsupportedTypeException(eventType);
    }
    handlers.compute(
        eventType,
        (type, existing) -> {
          List<EventHandler<? extends DomainEvent>> updated =
              existing == null ? new ArrayList<>() : new ArrayList<>(existing);
          updated.add(handler);
          updated.sort(Comparator.comparingInt(EventHandler::getPriority));
          return new CopyOnWriteArrayList<>(updated);
        });
    log.info(
        "Registering handler {} for event type: {}", handler.getClass().getSimpleName(), eventType);
  }

  /** Removes every handler registered for the type. */
  public void unregisterHandler(String eventType) {
    List<EventHandler<? extends DomainEvent>> removed = handlers.remove(eventType);
    if (removed != null) {
      log.info("Unregistered {} handler(s) for event type: {}", removed.size(), eventType);
    }
  }

  /** Subscribes a plain callback; returns the id used to unsubscribe. */
  public String subscribe(String eventType, Consumer<DomainEvent> callback) {
    String id = "sub_" + subscriptionIds.incrementAndGet();
    subscriptions.put(id, new Subscription(id, eventType, callback, 0));
    log.debug("Subscription {} added for event type: {}", id, eventType);
    return id;
  }

  public boolean unsubscribe(String subscriptionId) {
    return subscriptions.remove(subscriptionId) != null;
  }

  private void dispatch(DomainEvent event) {
    String eventType = event.eventType();
    List<Delivery> deliveries = collectDeliveries(eventType);
    if (deliveries.isEmpty()) {
      log.debug("No handlers for event type: {}", eventType);
      return;
    }
    log.debug(
        "Publishing event {} id={} to {} handler(s)",
        eventType,
        event.getEventId(),
        deliveries.size());

    ForkJoinPool executor = pool;
    Duration timeout = handlerTimeout;
    boolean bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
    long deadline = bounded ? System.nanoTime() + timeout.toNanos() : 0L;
    CompletableFuture<?>[] futures = new CompletableFuture<?>[deliveries.size()];
    for (int i = 0; i < deliveries.size(); i++) {
      Delivery delivery = deliveries.get(i);
      CompletableFuture<Boolean> future =
          CompletableFuture.supplyAsync(() -> deliver(delivery, event, deadline), executor);
      if (bounded) {
        future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
      }
      futures[i] =
          future.handle(
              (handled, error) -> {
                if (error != null) {
                  onFailure(delivery, event, describeFailure(error, delivery, event, timeout));
                } else if (Boolean.TRUE.equals(handled)) {
                  succeeded.incrementAndGet();
                }
                return null;
              });
    }
    CompletableFuture.allOf(futures).join();
  }

  private List<Delivery> collectDeliveries(String eventType) {
    List<Delivery> deliveries = new ArrayList<>();
    for (EventHandler<? extends DomainEvent> handler :
        handlers.getOrDefault(eventType, List.of())) {
      deliveries.add(new Delivery(handler, null, handler.getPriority()));
    }
    for (Subscription subscription : subscriptions.values()) {
      if (subscription.eventType().equals(eventType)) {
        deliveries.add(new Delivery(null, subscription, subscription.priority()));
      }
    }
    deliveries.sort(Comparator.comparingInt(Delivery::priority));
    return deliveries;
  }

  /** Returns true when the handler actually processed the event. */
  @SuppressWarnings("unchecked")
  private boolean deliver(Delivery delivery, DomainEvent event, long deadline) {
    if (delivery.subscription() != null) {
      delivery.subscription().callback().accept(event);
      return true;
    }
    EventHandler<DomainEvent> handler = (EventHandler<DomainEvent>) delivery.handler();
    if (handler.shouldIgnore(event)) {
      return false;
    }
    if (handler.isEventProcessed(event)) {
      log.debug("Event {} already processed by {}", event.getEventId(), describe(delivery));
      return false;
    }
    handler.validateEvent(event);
    if (!handler.canHandle(event)) {
      return false;
    }
    handleWithRetry(handler, event, deadline);
    if (isExpired(deadline)) {
      log.warn(
          "Handler {} finished event {} after its timeout, not marking it processed",
          describe(delivery),
          event.getEventId());
      return false;
    }
    handler.markEventAsProcessed(event);
    return true;
  }

  private void handleWithRetry(
      EventHandler<DomainEvent> handler, DomainEvent event, long deadline) {
    int maxRetries = handler.getMaxRetries(event);
    int retryCount = 0;
    while (true) {
      if (isExpired(deadline)) {
        throw new DeadlineExceededException(
            "Delivery deadline passed before attempt "
                + (retryCount + 1)
                + " of event "
                + event.getEventId());
      }
      try {
        handler.handle(event);
        return;
      } catch (RuntimeException e) {
        if (retryCount >= maxRetries) {
          throw e;
        }
        retryCount++;
        retried.incrementAndGet();
        Duration delay = handler.getRetryDelay(event, retryCount);
        log.warn(
            "Handler {} failed for event {} (retry {}/{} in {}): {}",
            handler.getClass().getSimpleName(),
            event.getEventId(),
            retryCount,
            maxRetries,
            delay,
            e.getMessage());
        pause(delay);
      }
    }
  }

  private void pause(Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientException("Interrupted while waiting to retry event handler", e);
    }
  }

  @SuppressWarnings("unchecked")
  private void onFailure(Delivery delivery, DomainEvent event, Throwable error) {
    failed.incrementAndGet();
    log.error(
        "Error handling event {} id={} in {}",
        event.eventType(),
        event.getEventId(),
        describe(delivery),
        error);
    if (delivery.handler() == null) {
      return;
    }
    try {
      ((EventHandler<DomainEvent>) delivery.handler()).handleFailure(event, error);
    } catch (RuntimeException e) {
      log.error("Failure callback of {} threw", describe(delivery), e);
    }
  }

  private static boolean isExpired(long deadline) {
    return deadline != 0L && System.nanoTime() - deadline >= 0;
  }

  private static RuntimeException describeFailure(
      Throwable error, Delivery delivery, DomainEvent event, Duration timeout) {
    RuntimeException failure = unwrap(error);
    if (failure.getCause() instanceof TimeoutException) {
      return new DeadlineExceededException(
          "Handler "
              + describe(delivery)
              + " timed out after "
              + timeout.toMillis()
              + "ms on event "
              + event.eventType()
              + " id="
              + event.getEventId(),
          failure.getCause());
    }
    return failure;
  }

  private static String describe(Delivery delivery) {
    return delivery.handler() != null
        ? delivery.handler().getClass().getSimpleName()
        : delivery.subscription().id();
  }

  private static RuntimeException unwrap(Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    return new TransientException("Event delivery failed: " + cause.getMessage(), cause);
  }

  public boolean supports(String eventType) {
    List<EventHandler<? extends DomainEvent>> registered = handlers.get(eventType);
    if (registered != null && !registered.isEmpty()) {
      return true;
    }
    return subscriptions.values().stream().anyMatch(s -> s.eventType().equals(eventType));
  }

  public List<String> getRegisteredTypes() {
    Map<String, Boolean> types = new LinkedHashMap<>();
    handlers.keySet().forEach(type -> types.put(type, Boolean.TRUE));
    subscriptions.values().forEach(s -> types.put(s.eventType(), Boolean.TRUE));
    return List.copyOf(types.keySet());
  }

  public int getHandlerCount() {
    return handlers.values().stream().mapToInt(List::size).sum();
  }

  public int getHandlerCount(String eventType) {
    return handlers.getOrDefault(eventType, List.of()).size();
  }

  public int getSubscriptionCount() {
    return subscriptions.size();
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

  public void clearSubscriptions() {
    subscriptions.clear();
  }

  public void clearMiddlewares() {
    middlewares.clear();
  }

  public EventBusStats getStats() {
    return new EventBusStats(
        getHandlerCount(),
        getSubscriptionCount(),
        getMiddlewareCount(),
        published.get(),
        succeeded.get(),
        failed.get(),
        retried.get());
  }

  public boolean isRunning() {
    return !pool.isShutdown();
  }

  /** Stops the dispatch pool. Publishing afterwards is rejected. */
  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Event dispatch pool did not terminate within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private record Subscription(
      String id, String eventType, Consumer<DomainEvent> callback, int priority) {}

  private record Delivery(
      EventHandler<? extends DomainEvent> handler, Subscription subscription, int priority) {}
}
