package io.intellixity.tenancy.authz;

import java.util.Locale;

public enum Verb {
  GET,
  LIST,
  CREATE,
  UPDATE,
  DELETE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
