package io.intellixity.tenancy.store.entity;

import java.util.Objects;

public record Tag(String key, String value) {
  public Tag {
    Objects.requireNonNull(key, "key");
  }
}
