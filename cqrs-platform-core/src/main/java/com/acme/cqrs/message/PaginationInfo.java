package com.acme.cqrs.message;

public record PaginationInfo(
    int page,
    int pageSize,
    long totalCount,
    long totalPages,
    boolean hasNext,
    boolean hasPrevious) {

  public static PaginationInfo of(int page, int pageSize, long totalCount) {
    long totalPages = pageSize <= 0 ? 0 : (totalCount + pageSize - 1) / pageSize;
    return new PaginationInfo(
        page, pageSize, totalCount, totalPages, page < totalPages, page > 1);
  }
}
