package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.authz.kubernetes.AuthorityException;
import io.intellixity.tenancy.authz.kubernetes.KubernetesAuthorityApi;
import io.intellixity.tenancy.authz.kubernetes.ResourceAttributes;
import io.intellixity.tenancy.authz.kubernetes.ReviewStatus;
import io.intellixity.tenancy.authz.kubernetes.ServiceAccountCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Delegated permission checks against the Kubernetes authority.\n
 *
 * {@link #authorize} runs with the caller's own token and fails closed. The two enumeration methods are
 * advisory: they degrade to empty lists instead of failing, and an empty list means "unknown".
 */
public final class AccessReviewClient {
  private static final Logger log = LoggerFactory.getLogger(AccessReviewClient.class);

  static final String MISSING_TOKEN = "Missing bearer token for authorization.";

  private static final Comparator<String> CASE_INSENSITIVE =
      Comparator.comparing((String s) -> s.toLowerCase(Locale.ROOT)).thenComparing(Comparator.naturalOrder());

  private final KubernetesAuthorityApi api;
  private final ServiceAccountCredentials serviceAccount;
  private final String apiGroup;

  public AccessReviewClient(KubernetesAuthorityApi api, ServiceAccountCredentials serviceAccount, String apiGroup) {
    this.api = Objects.requireNonNull(api, "api");
    this.serviceAccount = Objects.requireNonNull(serviceAccount, "serviceAccount");
    this.apiGroup = Objects.requireNonNull(apiGroup, "apiGroup");
  }

  public AccessDecision authorize(Optional<String> credential, String tenant, Classification classification) {
    if (credential.isEmpty()) return AccessDecision.unauthenticated(MISSING_TOKEN);
    ResourceAttributes attrs = new ResourceAttributes(
        apiGroup, classification.resource().wireName(), classification.verb().wireName(), tenant);
    ReviewStatus status;
    try {
      status = api.selfSubjectAccessReview(credential.get(), attrs);
    } catch (AuthorityException e) {
      return fromFailure(e, tenant, classification);
    }
    if (status.allowed()) {
      log.debug("tenancy.authz allowed tenant={} resource={} verb={}",
          tenant, attrs.resource(), attrs.verb());
      return AccessDecision.allowed();
    }
    String reason = status.reason() == null || status.reason().isBlank() ? "Access denied" : status.reason();
    log.info("tenancy.authz denied tenant={} resource={} verb={} reason={}", tenant, attrs.resource(), attrs.verb(), reason);
    return AccessDecision.denied("Access denied by SSAR: " + reason);
  }

  private static AccessDecision fromFailure(AuthorityException e, String tenant, Classification c) {
    switch (e.status()) {
      case 401:
        log.info("tenancy.authz unauthenticated tenant={} resource={} verb={}", tenant, c.resource().wireName(), c.verb().wireName());
        return AccessDecision.unauthenticated("Invalid or expired token");
      case 403:
        log.info("tenancy.authz denied tenant={} reason=review-forbidden", tenant);
        return AccessDecision.denied("Insufficient permissions for authorization check");
      default:
        log.warn("tenancy.authz unavailable tenant={} status={} error={}", tenant, e.status(), e.getMessage());
        return e.hasResponse()
            ? AccessDecision.unavailable("Authorization service error: " + e.status())
            : AccessDecision.unavailable("Authorization check failed: " + rootName(e));
    }
  }

  private static String rootName(Throwable t) {
    Throwable cur = t;
    while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
    return cur.getClass().getSimpleName();
  }

  /** Every namespace the server's own identity can see, sorted case-insensitively; empty when unknown. */
  public List<String> listAllTenants() {
    Optional<String> token = serviceAccount.token();
    if (token.isEmpty()) {
      log.debug("tenancy.authz op=listAllTenants skipped=no-service-account-token");
      return List.of();
    }
    try {
      return sortedDistinct(api.listNamespaces(token.get()));
    } catch (AuthorityException e) {
      log.warn("tenancy.authz op=listAllTenants status={} error={}", e.status(), e.getMessage());
      return List.of();
    }
  }

  /** Candidates on which the caller may {@code list} at least one resource type, sorted case-insensitively. */
  public List<String> filterAccessibleTenants(Optional<String> credential, Collection<String> candidates) {
    if (credential.isEmpty() || candidates == null || candidates.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (String tenant : new LinkedHashSet<>(candidates)) {
      if (tenant != null && !tenant.isBlank() && canList(credential.get(), tenant)) out.add(tenant);
    }
    out.sort(CASE_INSENSITIVE);
    return out;
  }

  private boolean canList(String token, String tenant) {
    for (ResourceType r : ResourceType.values()) {
      try {
        ReviewStatus s = api.selfSubjectAccessReview(token, new ResourceAttributes(apiGroup, r.wireName(), Verb.LIST.wireName(), tenant));
        if (s.allowed()) return true;
      } catch (AuthorityException e) {
        log.warn("tenancy.authz op=probe tenant={} status={} error={}", tenant, e.status(), e.getMessage());
        return false;
      }
    }
    return false;
  }

  private static List<String> sortedDistinct(Collection<String> names) {
    List<String> out = new ArrayList<>(new LinkedHashSet<>(names));
    out.sort(CASE_INSENSITIVE);
    return out;
  }
}
