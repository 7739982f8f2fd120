package com.acme.cqrs.usecase;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryUseCaseRegistry implements UseCaseRegistry {
  private static final Logger log = LoggerFactory.getLogger(InMemoryUseCaseRegistry.class);

  private final Map<String, UseCase<?, ?>> useCases = new ConcurrentHashMap<>();

  @Override
  public void register(String name, UseCase<?, ?> useCase) {
    if (useCases.putIfAbsent(name, useCase) != null) {
      throw new IllegalStateException("Use case already registered: " + name);
    }
    log.info("Registering use case: {}", name);
  }

  @Override
  public Optional<UseCase<?, ?>> get(String name) {
    return Optional.ofNullable(useCases.get(name));
  }

  @Override
  public boolean has(String name) {
    return useCases.containsKey(name);
  }

  @Override
  public List<String> getNames() {
    return List.copyOf(useCases.keySet());
  }
}
