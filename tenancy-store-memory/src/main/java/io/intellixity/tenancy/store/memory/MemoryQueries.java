package io.intellixity.tenancy.store.memory;

import io.intellixity.tenancy.store.MetadataStoreException;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.ViewType;
import io.intellixity.tenancy.store.entity.LifecycleStage;
import io.intellixity.tenancy.store.filter.FilterClause;

import java.util.List;
import java.util.Map;

/** Filter evaluation and offset pagination shared by the in-memory stores. */
final class MemoryQueries {
  private MemoryQueries() {}

  static boolean matches(List<FilterClause> clauses, Map<String, String> attributes, Map<String, String> tags) {
    for (FilterClause c : clauses) {
      String actual;
      if (c.isTag()) {
        actual = tags.get(c.tagKey());
      } else if (attributes.containsKey(c.property())) {
        actual = attributes.get(c.property());
      } else {
        throw MetadataStoreException.invalidParameter("Unsupported filter attribute: " + c.property());
      }
      if (!c.test(actual)) return false;
    }
    return true;
  }

  static boolean visible(ViewType viewType, LifecycleStage stage) {
    ViewType v = viewType == null ? ViewType.ACTIVE_ONLY : viewType;
    switch (v) {
      case ALL:
        return true;
      case DELETED_ONLY:
        return stage == LifecycleStage.DELETED;
      default:
        return stage == LifecycleStage.ACTIVE;
    }
  }

  static <T> PagedList<T> page(List<T> all, int maxResults, String pageToken) {
    if (maxResults <= 0) throw MetadataStoreException.invalidParameter("max_results must be positive, got " + maxResults);
    int offset = parseToken(pageToken);
    if (offset >= all.size()) return PagedList.empty();
    int end = (int) Math.min((long) offset + maxResults, all.size());
    String next = end < all.size() ? String.valueOf(end) : null;
    return new PagedList<>(all.subList(offset, end), next);
  }

  private static int parseToken(String pageToken) {
    if (pageToken == null || pageToken.isBlank()) return 0;
    try {
      int offset = Integer.parseInt(pageToken.trim());
      if (offset < 0) throw MetadataStoreException.invalidParameter("Invalid page token: " + pageToken);
      return offset;
    } catch (NumberFormatException e) {
      throw new MetadataStoreException(io.intellixity.tenancy.core.ErrorCode.INVALID_PARAMETER_VALUE,
          "Invalid page token: " + pageToken, e);
    }
  }
}
