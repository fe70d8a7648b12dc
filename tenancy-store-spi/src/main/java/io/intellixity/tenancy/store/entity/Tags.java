package io.intellixity.tenancy.store.entity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions between tag lists and the immutable tag maps carried by entities. */
public final class Tags {
  private Tags() {}

  public static Map<String, String> toMap(Collection<Tag> tags) {
    if (tags == null || tags.isEmpty()) return Map.of();
    Map<String, String> out = new LinkedHashMap<>();
    for (Tag t : tags) {
      if (t == null) continue;
      out.put(t.key(), t.value());
    }
    return out;
  }

  public static List<Tag> toList(Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) return List.of();
    return tags.entrySet().stream().map(e -> new Tag(e.getKey(), e.getValue())).toList();
  }

  /** Immutable copy that tolerates null values, which {@link Map#copyOf} rejects. */
  static Map<String, String> copy(Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) return Map.of();
    return java.util.Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }
}
