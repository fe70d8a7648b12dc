package io.intellixity.tenancy.store.entity;

import java.util.Map;
import java.util.Objects;

public record Experiment(String experimentId,
                         String name,
                         String artifactLocation,
                         LifecycleStage lifecycleStage,
                         Map<String, String> tags) {
  public Experiment {
    Objects.requireNonNull(experimentId, "experimentId");
    tags = Tags.copy(tags);
  }

  public String tag(String key) {
    return tags.get(key);
  }
}
