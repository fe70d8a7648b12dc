package io.intellixity.tenancy.isolation;

import io.intellixity.tenancy.core.TenancyException;
import io.intellixity.tenancy.store.entity.Tag;
import io.intellixity.tenancy.store.filter.SearchFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The reserved tenant tag carried by every tagged entity.\n
 *
 * The tag is written once on create and is never mutated through the isolation layer afterwards.
 */
public final class TenantTags {
  public static final String TENANT_TAG_KEY = "mlflow.namespace";

  private TenantTags() {}

  /** Return {@code tags} with the tenant tag present exactly once. A foreign value is rejected. */
  static List<Tag> ensure(List<Tag> tags, String tenant) {
    List<Tag> out = new ArrayList<>();
    boolean present = false;
    if (tags != null) {
      for (Tag t : tags) {
        if (t == null) continue;
        if (TENANT_TAG_KEY.equals(t.key())) {
          requireOwnValue(t.value(), tenant);
          if (present) continue;
          present = true;
        }
        out.add(t);
      }
    }
    if (!present) out.add(new Tag(TENANT_TAG_KEY, tenant));
    return out;
  }

  static Map<String, String> ensure(Map<String, String> tags, String tenant) {
    Map<String, String> out = tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags);
    if (out.containsKey(TENANT_TAG_KEY)) requireOwnValue(out.get(TENANT_TAG_KEY), tenant);
    out.put(TENANT_TAG_KEY, tenant);
    return out;
  }

  static String predicate(String tenant) {
    return SearchFilter.tagEquals(TENANT_TAG_KEY, tenant);
  }

  static boolean owns(Map<String, String> tags, String tenant) {
    return tags != null && tenant.equals(tags.get(TENANT_TAG_KEY));
  }

  static void rejectReservedKey(String key) {
    if (TENANT_TAG_KEY.equals(key)) {
      throw TenancyException.permissionDenied("Tag '" + TENANT_TAG_KEY + "' is reserved and cannot be modified");
    }
  }

  static void rejectReservedKeys(List<Tag> tags) {
    if (tags == null) return;
    for (Tag t : tags) {
      if (t != null) rejectReservedKey(t.key());
    }
  }

  static void rejectReservedKeys(Map<String, String> tags) {
    if (tags != null) tags.keySet().forEach(TenantTags::rejectReservedKey);
  }

  private static void requireOwnValue(String value, String tenant) {
    if (!tenant.equals(value)) {
      throw TenancyException.permissionDenied("Tag '" + TENANT_TAG_KEY + "' must match the request namespace");
    }
  }
}
