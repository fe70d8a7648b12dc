package io.intellixity.tenancy.store.entity;

import java.util.Map;
import java.util.Objects;

public record Prompt(String name, String description, Map<String, String> tags) {
  public Prompt {
    Objects.requireNonNull(name, "name");
    tags = Tags.copy(tags);
  }

  public String tag(String key) {
    return tags.get(key);
  }

  public Prompt withName(String newName) {
    return new Prompt(newName, description, tags);
  }
}
