package com.acme.cqrs.message;

public enum SortDirection {
  ASC,
  DESC
}
