package io.intellixity.tenancy.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-request tenant context: the validated tenant identity and, when it was resolved, the acting user.
 * <p>
 * Set once by the authorization gateway and immutable for the rest of the request.
 */
public record TenantContext(String tenant, String user) {
  public TenantContext {
    Objects.requireNonNull(tenant, "tenant");
    if (tenant.isBlank()) throw new IllegalArgumentException("tenant is blank");
  }

  public static TenantContext of(String tenant) {
    return new TenantContext(tenant, null);
  }

  public Optional<String> userOptional() {
    return Optional.ofNullable(user);
  }

  public NameTransformer names() {
    return new NameTransformer(tenant);
  }
}
