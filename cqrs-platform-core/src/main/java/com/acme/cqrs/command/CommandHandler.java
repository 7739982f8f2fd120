package com.acme.cqrs.command;

import com.acme.cqrs.message.Command;

/**
 * Handles one command type. Registered explicitly with {@link CommandBus#registerHandler}; the
 * defaults describe a handler with no validation, no preconditions and neutral priority.
 */
public interface CommandHandler<C extends Command> {

  void execute(C command);

  boolean supports(String commandType);

  /** Throws {@link com.acme.cqrs.core.ValidationException} when the command is malformed. */
  default void validateCommand(C command) {}

  /** Precondition checked after validation; false rejects the command. */
  default boolean canHandle(C command) {
    return true;
  }

  default int getPriority() {
    return 0;
  }
}
