package com.acme.cqrs.command;

import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.core.DeadlineExceededException;
import com.acme.cqrs.core.DuplicateHandlerException;
import com.acme.cqrs.core.HandlerNotFoundException;
import com.acme.cqrs.core.HandlerRejectedException;
import com.acme.cqrs.core.UnsupportedTypeException;
import com.acme.cqrs.message.Command;
import com.acme.cqrs.message.MessageContext;
import com.acme.cqrs.middleware.Middleware;
import com.acme.cqrs.middleware.MiddlewareChain;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each command to the single handler registered for its {@code commandType}, wrapped by
 * the bus middleware chain. No caching and no retry at this layer.
 */
public class CommandBus {
  private static final Logger log = LoggerFactory.getLogger(CommandBus.class);

  private final Map<String, CommandHandler<? extends Command>> handlers = new ConcurrentHashMap<>();
  private final MiddlewareChain middlewares = new MiddlewareChain("CommandBus");
  private volatile Duration timeout;

  public CommandBus() {
    this(new CqrsConfig());
  }

  public CommandBus(CqrsConfig config) {
    applyConfiguration(config);
  }

  public void applyConfiguration(CqrsConfig config) {
    this.timeout = config.getCommandTimeout();
  }

  /**
   * Register the handler for a command type.
   *
   * @throws DuplicateHandlerException if the type already has a handler; the existing one stays
   * @throws UnsupportedTypeException if the handler does not support the type
   */
  public void registerHandler(String commandType, CommandHandler<? extends Command> handler) {
    if (handlers.containsKey(commandType)) {
      log.error("Handler already registered for command type: {}", commandType);
      throw new DuplicateHandlerException(commandType);
    }
    if (!handler.supports(commandType)) {
      throw new UnsupportedTypeException(commandType);
    }
    if (handlers.putIfAbsent(commandType, handler) != null) {
      throw new DuplicateHandlerException(commandType);
    }
    log.info("Registering handler for command type: {}", commandType);
  }

  public void unregisterHandler(String commandType) {
    if (handlers.remove(commandType) != null) {
      log.info("Unregistered handler for command type: {}", commandType);
    }
  }

  /**
   * Dispatch a command through the middleware chain to its handler.
   *
   * @throws HandlerNotFoundException if no handler is registered for the command type
   * @throws HandlerRejectedException if the handler's {@code canHandle} returns false
   */
  public void execute(Command command) {
    String commandType = command.commandType();
    CommandHandler<Command> handler = lookup(commandType);
    MessageContext context = MessageContext.of(command, timeout);
    log.debug("Executing command: {} id={}", commandType, command.getCommandId());

    middlewares.run(
        context,
        () -> {
          invoke(handler, command, context);
          return null;
        });
  }

  private void invoke(CommandHandler<Command> handler, Command command, MessageContext context) {
    if (context.isExpired()) {
      throw new DeadlineExceededException(
          "Deadline exceeded before handling command: " + command.commandType());
    }
    handler.validateCommand(command);
    if (!handler.canHandle(command)) {
      throw new HandlerRejectedException(
          "Handler cannot process command: " + command.commandType());
    }
    handler.execute(command);
  }

  @SuppressWarnings("unchecked")
  private CommandHandler<Command> lookup(String commandType) {
    CommandHandler<? extends Command> handler = handlers.get(commandType);
    if (handler == null) {
      log.error("No handler registered for command type: {}", commandType);
      throw new HandlerNotFoundException(commandType);
    }
    return (CommandHandler<Command>) handler;
  }

  public Optional<CommandHandler<? extends Command>> getHandler(String commandType) {
    return Optional.ofNullable(handlers.get(commandType));
  }

  public boolean supports(String commandType) {
    return handlers.containsKey(commandType);
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
