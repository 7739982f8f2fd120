package com.acme.cqrs.message;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read request routed by {@link #queryType()} to exactly one handler. Paging values are clamped on
 * construction: page to at least 1, page size into {@code [1, MAX_PAGE_SIZE]}.
 */
public abstract class Query extends Message {

  public static final int DEFAULT_PAGE_SIZE = 10;
  public static final int MAX_PAGE_SIZE = 1000;

  private final int page;
  private final int pageSize;
  private final List<SortRule> sortRules;
  private final int queryVersion;

  protected Query(String tenantId, String userId) {
    this(tenantId, userId, 1, DEFAULT_PAGE_SIZE, List.of());
  }

  protected Query(
      String tenantId, String userId, int page, int pageSize, List<SortRule> sortRules) {
    this(tenantId, userId, page, pageSize, sortRules, 1, Map.of());
  }

  protected Query(
      String tenantId,
      String userId,
      int page,
      int pageSize,
      List<SortRule> sortRules,
      int queryVersion,
      Map<String, Object> metadata) {
    super(tenantId, userId, metadata);
    if (queryVersion < 1) {
      throw new IllegalArgumentException("Query version must be greater than 0");
    }
    this.page = Math.max(1, page);
    this.pageSize = Math.min(Math.max(1, pageSize), MAX_PAGE_SIZE);
    this.sortRules = sortRules == null ? List.of() : List.copyOf(sortRules);
    this.queryVersion = queryVersion;
  }

  public abstract String queryType();

  @Override
  public final String messageType() {
    return queryType();
  }

  public int getPage() {
    return page;
  }

  public int getPageSize() {
    return pageSize;
  }

  public List<SortRule> getSortRules() {
    return sortRules;
  }

  public int getQueryVersion() {
    return queryVersion;
  }

  public int offset() {
    return (page - 1) * pageSize;
  }

  public int limit() {
    return pageSize;
  }

  /** Returns a copy with the rule appended. */
  public Query withSortRule(String field, SortDirection direction) {
    List<SortRule> rules = new ArrayList<>(sortRules);
    rules.add(new SortRule(field, direction));
    return copyWithSortRules(rules);
  }

  /** Returns a copy without any rule on {@code field}. */
  public Query withoutSortRule(String field) {
    List<SortRule> rules = new ArrayList<>(sortRules);
    rules.removeIf(rule -> rule.field().equals(field));
    return copyWithSortRules(rules);
  }

  /**
   * Creates an otherwise equal query with different sort rules. Query types that support sort
   * changes override this.
   */
  protected Query copyWithSortRules(List<SortRule> rules) {
    throw new UnsupportedOperationException(
        getClass().getSimpleName() + " does not support changing sort rules");
  }
}
