package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.core.TenancyException;
import io.intellixity.tenancy.core.TenantIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tenants visible to the caller: namespaces enumerated with the server identity, plus the tenant the request
 * declares, plus the configured static candidates when enumeration found nothing, filtered by what the caller's
 * own token may list.
 */
public final class TenantDiscovery {
  private static final Logger log = LoggerFactory.getLogger(TenantDiscovery.class);

  static final String NONE_ACCESSIBLE = "No accessible namespaces for the provided token.";

  private final AccessReviewClient reviews;
  private final String tenantHeader;
  private final List<String> staticCandidates;

  public TenantDiscovery(AccessReviewClient reviews, String tenantHeader, List<String> staticCandidates) {
    this.reviews = Objects.requireNonNull(reviews, "reviews");
    this.tenantHeader = Objects.requireNonNull(tenantHeader, "tenantHeader");
    this.staticCandidates = staticCandidates == null ? List.of() : List.copyOf(staticCandidates);
  }

  /** Throws {@link TenancyException} (permission denied) when nothing is accessible. */
  public List<String> discover(InboundRequest request) {
    Set<String> candidates = new LinkedHashSet<>();
    List<String> enumerated = reviews.listAllTenants();
    candidates.addAll(enumerated);

    String declared = request.header(tenantHeader);
    if (declared != null && TenantIds.isValid(declared.trim())) candidates.add(declared.trim());

    if (enumerated.isEmpty()) {
      for (String c : staticCandidates) {
        if (c != null && !c.isBlank()) candidates.add(c.trim());
      }
    }

    List<String> accessible = reviews.filterAccessibleTenants(BearerTokens.extract(request), candidates);
    log.debug("tenancy.discovery candidates={} accessible={}", candidates.size(), accessible.size());
    if (accessible.isEmpty()) throw TenancyException.permissionDenied(NONE_ACCESSIBLE);
    return accessible;
  }

  /** Splits a comma-separated candidate list. */
  public static List<String> parseCandidates(String csv) {
    if (csv == null || csv.isBlank()) return List.of();
    Set<String> out = new LinkedHashSet<>();
    for (String part : csv.split(",")) {
      if (!part.isBlank()) out.add(part.trim());
    }
    return List.copyOf(out);
  }
}
