package com.acme.cqrs.message;

import java.util.Objects;

public record SortRule(String field, SortDirection direction) {

  public SortRule {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(direction, "direction");
  }

  public static SortRule asc(String field) {
    return new SortRule(field, SortDirection.ASC);
  }

  public static SortRule desc(String field) {
    return new SortRule(field, SortDirection.DESC);
  }
}
