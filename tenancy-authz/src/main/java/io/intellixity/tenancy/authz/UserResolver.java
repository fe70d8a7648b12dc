package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.authz.kubernetes.AuthorityException;
import io.intellixity.tenancy.authz.kubernetes.KubernetesAuthorityApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the acting user for audit purposes: identity headers set by an authenticating proxy first, then a
 * self subject review with the caller's token. Never fails the request.
 */
public final class UserResolver {
  private static final Logger log = LoggerFactory.getLogger(UserResolver.class);

  public static final List<String> FORWARDED_USER_HEADERS =
      List.of("X-Forwarded-Preferred-Username", "X-Forwarded-User", "X-Forwarded-Email");

  private final KubernetesAuthorityApi api;

  public UserResolver(KubernetesAuthorityApi api) {
    this.api = Objects.requireNonNull(api, "api");
  }

  public Optional<String> resolve(InboundRequest request) {
    for (String header : FORWARDED_USER_HEADERS) {
      String v = request.header(header);
      if (v != null && !v.isBlank()) return Optional.of(v.trim());
    }
    Optional<String> token = BearerTokens.extract(request);
    if (token.isEmpty()) return Optional.empty();
    try {
      return api.selfSubjectUsername(token.get());
    } catch (AuthorityException e) {
      log.debug("tenancy.authz op=resolveUser unresolved status={}", e.status());
      return Optional.empty();
    }
  }
}
