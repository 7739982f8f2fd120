package com.acme.cqrs.usecase;

import java.util.List;
import java.util.Optional;

public interface UseCaseRegistry {

  void register(String name, UseCase<?, ?> useCase);

  Optional<UseCase<?, ?>> get(String name);

  boolean has(String name);

  List<String> getNames();
}
