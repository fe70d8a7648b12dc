package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.TenantContext;
import io.intellixity.tenancy.core.TenantIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Per-request authorization: exempt check, tenant header, tenant grammar, optional user resolution,
 * classification, delegated access review. The first failing step decides the outcome.\n
 *
 * The gateway has no side effects; binding the returned context is the caller's job.
 */
public final class AuthorizationGateway {
  private static final Logger log = LoggerFactory.getLogger(AuthorizationGateway.class);

  public static final String DEFAULT_TENANT_HEADER = "X-MLflow-Namespace";

  private final ExemptPaths exemptPaths;
  private final String tenantHeader;
  private final AccessReviewClient reviews;
  private final UserResolver users;

  public AuthorizationGateway(ExemptPaths exemptPaths, String tenantHeader, AccessReviewClient reviews, UserResolver users) {
    this.exemptPaths = Objects.requireNonNull(exemptPaths, "exemptPaths");
    this.tenantHeader = tenantHeader == null || tenantHeader.isBlank() ? DEFAULT_TENANT_HEADER : tenantHeader;
    this.reviews = Objects.requireNonNull(reviews, "reviews");
    this.users = Objects.requireNonNull(users, "users");
  }

  public String tenantHeader() { return tenantHeader; }

  public GatewayDecision evaluate(InboundRequest request) {
    String path = request.path() == null ? "" : request.path();
    if (exemptPaths.isExempt(path)) return GatewayDecision.exempt();

    String tenant = request.header(tenantHeader);
    if (tenant == null || tenant.isBlank()) {
      return GatewayDecision.denied(ErrorCode.INVALID_PARAMETER_VALUE,
          "Missing " + tenantHeader + " header while multitenancy is enabled.");
    }
    tenant = tenant.trim();
    if (!TenantIds.isValid(tenant)) {
      return GatewayDecision.denied(ErrorCode.INVALID_PARAMETER_VALUE,
          "Invalid namespace format. Must follow Kubernetes naming conventions.");
    }

    String method = request.method() == null ? "GET" : request.method().toUpperCase(Locale.ROOT);
    String user = requiresUser(path, method) ? users.resolve(request).orElse(null) : null;

    Classification classification = RequestClassifier.classify(path, method);
    AccessDecision decision = reviews.authorize(BearerTokens.extract(request), tenant, classification);
    if (!decision.isAllowed()) {
      log.debug("tenancy.gateway denied method={} path={} tenant={} outcome={}", method, path, tenant, decision.outcome());
      return GatewayDecision.denied(decision.errorCode(), decision.reason());
    }
    log.debug("tenancy.gateway authorized method={} path={} tenant={} user={}", method, path, tenant, user);
    return GatewayDecision.authorized(new TenantContext(tenant, user), classification);
  }

  /** Run creation and batched logging record the acting user. */
  static boolean requiresUser(String path, String method) {
    if (!"POST".equals(method)) return false;
    String p = path.toLowerCase(Locale.ROOT);
    return p.contains("/runs/create") || p.contains("/runs/log-batch");
  }
}
