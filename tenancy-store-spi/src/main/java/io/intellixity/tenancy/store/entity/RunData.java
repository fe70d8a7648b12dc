package io.intellixity.tenancy.store.entity;

import java.util.List;
import java.util.Map;

/** Latest metric values plus params and tags of a run. */
public record RunData(List<Metric> metrics, Map<String, String> params, Map<String, String> tags) {
  public RunData {
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
    params = Tags.copy(params);
    tags = Tags.copy(tags);
  }

  public static RunData empty() {
    return new RunData(List.of(), Map.of(), Map.of());
  }
}
