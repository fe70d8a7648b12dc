package io.intellixity.tenancy.store.entity;

import java.util.Map;
import java.util.Objects;

public record TraceInfo(String traceId, String experimentId, long timestampMs, Map<String, String> tags) {
  public TraceInfo {
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(experimentId, "experimentId");
    tags = Tags.copy(tags);
  }
}
