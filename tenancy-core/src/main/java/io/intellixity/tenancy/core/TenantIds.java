package io.intellixity.tenancy.core;

import java.util.regex.Pattern;

/**
 * Tenant identity grammar: lowercase alphanumeric segments joined by single hyphens, 1 to 253 characters.
 */
public final class TenantIds {
  private TenantIds() {}

  public static final int MAX_LENGTH = 253;

  private static final Pattern GRAMMAR = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

  public static boolean isValid(String tenant) {
    if (tenant == null || tenant.isEmpty() || tenant.length() > MAX_LENGTH) return false;
    return GRAMMAR.matcher(tenant).matches();
  }

  /** Returns the tenant unchanged, or throws {@link ErrorCode#INVALID_PARAMETER_VALUE}. */
  public static String requireValid(String tenant) {
    if (!isValid(tenant)) {
      throw TenancyException.invalidParameter("Invalid namespace format. Must follow Kubernetes naming conventions.");
    }
    return tenant;
  }
}
