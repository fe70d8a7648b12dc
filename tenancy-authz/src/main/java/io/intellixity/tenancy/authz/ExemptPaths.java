package io.intellixity.tenancy.authz;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Paths that bypass tenant and credential checks. Entries ending in {@code /} match as prefixes, all others
 * match exactly. Configuration can add entries but never remove the built-in ones.
 */
public final class ExemptPaths {
  public static final String NAMESPACES_PATH = "/ajax-api/2.0/mlflow/namespaces";

  static final Set<String> BUILT_IN = Set.of(
      "/", "/static/", "/static-files/", "/js/", "/favicon.ico", "/.well-known/",
      NAMESPACES_PATH, "/health", "/version");

  private final List<String> exact = new ArrayList<>();
  private final List<String> prefixes = new ArrayList<>();

  public ExemptPaths(Collection<String> extra) {
    BUILT_IN.forEach(this::add);
    if (extra != null) extra.forEach(this::add);
  }

  public static ExemptPaths defaults() {
    return new ExemptPaths(List.of());
  }

  private void add(String p) {
    if (p == null || p.isBlank()) return;
    String path = p.trim();
    if (path.length() > 1 && path.endsWith("/")) prefixes.add(path);
    else exact.add(path);
  }

  public boolean isExempt(String path) {
    if (path == null) return false;
    if (exact.contains(path)) return true;
    for (String prefix : prefixes) {
      if (path.startsWith(prefix)) return true;
    }
    return false;
  }
}
