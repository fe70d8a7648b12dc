package io.intellixity.tenancy.authz;

import java.util.Optional;

/** Caller credential extraction: authorization header, then forwarded access token, then session cookie. */
public final class BearerTokens {
  public static final String AUTHORIZATION_HEADER = "Authorization";
  public static final String FORWARDED_TOKEN_HEADER = "X-Forwarded-Access-Token";
  public static final String TOKEN_COOKIE = "mlflow.k8s.bearerToken";

  private static final String BEARER_PREFIX = "Bearer ";

  private BearerTokens() {}

  public static Optional<String> extract(InboundRequest request) {
    String auth = request.header(AUTHORIZATION_HEADER);
    if (auth != null && auth.startsWith(BEARER_PREFIX)) {
      String token = auth.substring(BEARER_PREFIX.length()).trim();
      if (!token.isEmpty()) return Optional.of(token);
    }
    Optional<String> forwarded = nonBlank(request.header(FORWARDED_TOKEN_HEADER));
    if (forwarded.isPresent()) return forwarded;
    return nonBlank(request.cookie(TOKEN_COOKIE));
  }

  private static Optional<String> nonBlank(String v) {
    if (v == null || v.isBlank()) return Optional.empty();
    return Optional.of(v.trim());
  }
}
