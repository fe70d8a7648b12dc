package io.intellixity.tenancy.core;

import java.util.Objects;

/**
 * Maps tenant-visible names of named-singleton entities to stored names carrying a {@code "<tenant>::"} prefix.
 * <p>
 * Both directions are idempotent. Names that already contain the delimiter are not escaped, so a visible name
 * that happens to start with the tenant's own prefix is indistinguishable from a stored name.
 */
public final class NameTransformer {
  public static final String DELIMITER = "::";

  private final String tenant;
  private final String prefix;

  public NameTransformer(String tenant) {
    this.tenant = Objects.requireNonNull(tenant, "tenant");
    this.prefix = tenant + DELIMITER;
  }

  public String tenant() { return tenant; }

  public String prefix() { return prefix; }

  public String toInternal(String name) {
    Objects.requireNonNull(name, "name");
    return name.startsWith(prefix) ? name : prefix + name;
  }

  public String fromInternal(String name) {
    if (name == null) return null;
    return name.startsWith(prefix) ? name.substring(prefix.length()) : name;
  }

  public boolean belongsTo(String name) {
    return name != null && name.startsWith(prefix);
  }
}
