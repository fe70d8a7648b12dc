package io.intellixity.tenancy.authz;

import java.util.Objects;

/** The (resource type, verb) half of an authorization tuple; the tenant completes it. */
public record Classification(ResourceType resource, Verb verb) {
  public Classification {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(verb, "verb");
  }
}
