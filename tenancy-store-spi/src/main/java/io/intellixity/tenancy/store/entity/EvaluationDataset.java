package io.intellixity.tenancy.store.entity;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record EvaluationDataset(String datasetId, String name, List<String> experimentIds, Map<String, String> tags) {
  public EvaluationDataset {
    Objects.requireNonNull(datasetId, "datasetId");
    experimentIds = experimentIds == null ? List.of() : List.copyOf(experimentIds);
    tags = Tags.copy(tags);
  }

  public String tag(String key) {
    return tags.get(key);
  }
}
