package com.acme.cqrs.core;

public class UseCaseNotFoundException extends PermanentException {
  private final String useCaseName;

  public UseCaseNotFoundException(String useCaseName) {
    super("Use case not found: " + useCaseName);
    this.useCaseName = useCaseName;
  }

  public String getUseCaseName() {
    return useCaseName;
  }
}
