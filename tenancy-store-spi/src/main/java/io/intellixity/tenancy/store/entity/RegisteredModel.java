package io.intellixity.tenancy.store.entity;

import java.util.Map;
import java.util.Objects;

public record RegisteredModel(String name,
                              String description,
                              Map<String, String> tags,
                              Map<String, String> aliases,
                              long creationTimestamp) {
  public RegisteredModel {
    Objects.requireNonNull(name, "name");
    tags = Tags.copy(tags);
    aliases = Tags.copy(aliases);
  }

  public String tag(String key) {
    return tags.get(key);
  }

  public RegisteredModel withName(String newName) {
    return new RegisteredModel(newName, description, tags, aliases, creationTimestamp);
  }
}
