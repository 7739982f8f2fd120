package com.acme.cqrs.usecase;

/**
 * Application operation invoked by name through the facade.
 *
 * @param <I> request type
 * @param <O> response type
 */
@FunctionalInterface
public interface UseCase<I, O> {
  O execute(I request);
}
