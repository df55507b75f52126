package com.assetplatform.assetapi.assets;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public record AssetPaging(int limit, int skip, List<SortField> sort, boolean onlyRecordCount) {
  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 1000;
  public static final Set<String> SORTABLE_FIELDS = Set.of("name", "id", "createdOn", "lastChangedOn");

  public AssetPaging {
    sort = sort == null ? List.of() : List.copyOf(sort);
  }

  public static AssetPaging defaults() {
    return new AssetPaging(DEFAULT_LIMIT, 0, List.of(), false);
  }

  /**
   * Builds paging from raw request values. {@code sort} is a comma separated list of fields, a
   * leading {@code -} sorts descending.
   */
  public static AssetPaging of(Integer limit, Integer skip, String sort, Boolean onlyRecordCount) {
    int safeLimit = limit == null ? DEFAULT_LIMIT : Math.min(Math.max(limit, 1), MAX_LIMIT);
    int safeSkip = skip == null ? 0 : Math.max(skip, 0);
    return new AssetPaging(
        safeLimit, safeSkip, parseSort(sort), Boolean.TRUE.equals(onlyRecordCount));
  }

  private static List<SortField> parseSort(String sort) {
    if (sort == null || sort.isBlank()) {
      return List.of();
    }
    List<SortField> fields = new ArrayList<>();
    for (String token : sort.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      boolean ascending = !trimmed.startsWith("-");
      String field = ascending ? trimmed : trimmed.substring(1).trim();
      if (!SORTABLE_FIELDS.contains(field)) {
        throw new AssetValidationException("Unsupported sort field: " + field);
      }
      fields.add(new SortField(field, ascending));
    }
    return fields;
  }

  public record SortField(String field, boolean ascending) {}
}
