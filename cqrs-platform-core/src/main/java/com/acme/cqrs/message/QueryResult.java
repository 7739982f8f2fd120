package com.acme.cqrs.message;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Page of query data plus pagination metadata. */
public final class QueryResult<T> {

  private final List<T> data;
  private final PaginationInfo pagination;
  private final Map<String, Object> metadata;
  private final Instant createdAt;

  private QueryResult(List<T> data, PaginationInfo pagination, Map<String, Object> metadata) {
    this.data = List.copyOf(data);
    this.pagination = pagination;
    this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    this.createdAt = Instant.now();
  }

  public static <T> QueryResult<T> of(List<T> data, int page, int pageSize, long totalCount) {
    return new QueryResult<>(data, PaginationInfo.of(page, pageSize, totalCount), Map.of());
  }

  public static <T> QueryResult<T> of(
      List<T> data, int page, int pageSize, long totalCount, Map<String, Object> metadata) {
    return new QueryResult<>(data, PaginationInfo.of(page, pageSize, totalCount), metadata);
  }

  /** Result for {@code query}'s page. */
  public static <T> QueryResult<T> forQuery(Query query, List<T> data, long totalCount) {
    return of(data, query.getPage(), query.getPageSize(), totalCount);
  }

  /** A single item result, one page of one. */
  public static <T> QueryResult<T> single(T item) {
    return of(List.of(item), 1, 1, 1);
  }

  public static <T> QueryResult<T> empty(int page, int pageSize) {
    return of(List.of(), page, pageSize, 0);
  }

  public List<T> getData() {
    return data;
  }

  public PaginationInfo getPagination() {
    return pagination;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean hasData() {
    return !data.isEmpty();
  }

  public Optional<T> first() {
    return data.isEmpty() ? Optional.empty() : Optional.of(data.get(0));
  }

  public long getTotalCount() {
    return pagination.totalCount();
  }

  @Override
  public String toString() {
    return "QueryResult(items="
        + data.size()
        + ", total="
        + pagination.totalCount()
        + ", page="
        + pagination.page()
        + "/"
        + pagination.totalPages()
        + ")";
  }
}
