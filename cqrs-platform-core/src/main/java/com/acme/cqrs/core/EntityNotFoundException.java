package com.acme.cqrs.core;

public class EntityNotFoundException extends PermanentException {
  private final String entityName;
  private final String entityId;

  public EntityNotFoundException(String entityName, String entityId) {
    super("Entity not found: " + entityName + " id=" + entityId);
    this.entityName = entityName;
    this.entityId = entityId;
  }

  public String getEntityName() {
    return entityName;
  }

  public String getEntityId() {
    return entityId;
  }
}
