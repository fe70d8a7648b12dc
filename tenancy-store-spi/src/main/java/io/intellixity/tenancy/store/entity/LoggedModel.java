package io.intellixity.tenancy.store.entity;

import java.util.Map;
import java.util.Objects;

public record LoggedModel(String modelId, String experimentId, String name, Map<String, String> tags) {
  public LoggedModel {
    Objects.requireNonNull(modelId, "modelId");
    Objects.requireNonNull(experimentId, "experimentId");
    tags = Tags.copy(tags);
  }
}
