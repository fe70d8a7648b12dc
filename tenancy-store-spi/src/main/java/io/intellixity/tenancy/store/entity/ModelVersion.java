package io.intellixity.tenancy.store.entity;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ModelVersion(String name,
                           String version,
                           String source,
                           String runId,
                           String description,
                           String currentStage,
                           Map<String, String> tags,
                           List<String> aliases) {
  public ModelVersion {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
    tags = Tags.copy(tags);
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }

  public ModelVersion withName(String newName) {
    return new ModelVersion(newName, version, source, runId, description, currentStage, tags, aliases);
  }

  /** Numeric version for ordering; non-numeric versions sort first. */
  public long versionNumber() {
    try {
      return Long.parseLong(version);
    } catch (NumberFormatException e) {
      return 0L;
    }
  }
}
