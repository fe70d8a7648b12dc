package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.authz.kubernetes.AuthorityException;
import io.intellixity.tenancy.authz.kubernetes.ResourceAttributes;
import io.intellixity.tenancy.authz.kubernetes.ServiceAccountCredentials;
import io.intellixity.tenancy.core.ErrorCode;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class AccessReviewClientTest {

  private static final Classification CREATE_EXPERIMENTS = new Classification(ResourceType.EXPERIMENTS, Verb.CREATE);

  private final FakeAuthorityApi api = new FakeAuthorityApi();
  private final AccessReviewClient client =
      new AccessReviewClient(api, ServiceAccountCredentials.of("sa-token"), "community.mlflow.org");

  @Test
  void authorize_sendsTupleUnderApiGroup() {
    api.grant("t", "team-a", "experiments", "create");

    AccessDecision d = client.authorize(Optional.of("t"), "team-a", CREATE_EXPERIMENTS);

    assertTrue(d.isAllowed());
    assertEquals(new ResourceAttributes("community.mlflow.org", "experiments", "create", "team-a"), api.reviews.get(0));
  }

  @Test
  void authorize_missingCredentialIsUnauthenticatedWithoutCallingAuthority() {
    AccessDecision d = client.authorize(Optional.empty(), "team-a", CREATE_EXPERIMENTS);

    assertEquals(AccessDecision.Outcome.UNAUTHENTICATED, d.outcome());
    assertEquals(ErrorCode.UNAUTHENTICATED, d.errorCode());
    assertTrue(api.reviews.isEmpty());
  }

  @Test
  void authorize_denialCarriesAuthorityReason() {
    api.denyReason = "user bob cannot create experiments";

    AccessDecision d = client.authorize(Optional.of("t"), "team-a", CREATE_EXPERIMENTS);

    assertEquals(AccessDecision.Outcome.DENIED, d.outcome());
    assertEquals(ErrorCode.PERMISSION_DENIED, d.errorCode());
    assertTrue(d.reason().contains("user bob cannot create experiments"));
  }

  @Test
  void authorize_authorityStatusesMapToDistinctOutcomes() {
    api.reviewFailure = new AuthorityException(401, "unauthorized", null);
    AccessDecision unauthorized = client.authorize(Optional.of("t"), "team-a", CREATE_EXPERIMENTS);
    assertEquals(AccessDecision.Outcome.UNAUTHENTICATED, unauthorized.outcome());
    assertEquals("Invalid or expired token", unauthorized.reason());

    api.reviewFailure = new AuthorityException(403, "forbidden", null);
    assertEquals(AccessDecision.Outcome.DENIED, client.authorize(Optional.of("t"), "team-a", CREATE_EXPERIMENTS).outcome());

    api.reviewFailure = new AuthorityException(503, "unavailable", null);
    AccessDecision unavailable = client.authorize(Optional.of("t"), "team-a", CREATE_EXPERIMENTS);
    assertEquals(AccessDecision.Outcome.UNAVAILABLE, unavailable.outcome());
    assertEquals(ErrorCode.PERMISSION_DENIED, unavailable.errorCode());
    assertEquals("Authorization service error: 503", unavailable.reason());
  }

  @Test
  void authorize_transportFailureFailsClosed() {
    api.reviewFailure = new AuthorityException(0, "timeout", new SocketTimeoutException("read timed out"));

    AccessDecision d = client.authorize(Optional.of("t"), "team-a", CREATE_EXPERIMENTS);

    assertFalse(d.isAllowed());
    assertEquals("Authorization check failed: SocketTimeoutException", d.reason());
  }

  @Test
  void listAllTenants_usesServiceIdentityAndSorts() {
    api.namespaces = List.of("beta", "Alpha", "beta", "gamma");

    assertEquals(List.of("Alpha", "beta", "gamma"), client.listAllTenants());
    assertEquals("sa-token", api.lastListToken);
  }

  @Test
  void listAllTenants_degradesToEmpty() {
    api.listFailure = new AuthorityException(0, "connection refused", null);
    assertEquals(List.of(), client.listAllTenants());

    AccessReviewClient noIdentity = new AccessReviewClient(api, ServiceAccountCredentials.of(null), "g");
    assertEquals(List.of(), noIdentity.listAllTenants());
  }

  @Test
  void filterAccessibleTenants_anyListGrantIsEnough() {
    api.grant("t", "a", "experiments", "list")
        .grant("t", "c", "prompts", "list")
        .grant("t", "b", "experiments", "get");

    assertEquals(List.of("a", "c"), client.filterAccessibleTenants(Optional.of("t"), List.of("c", "b", "a", "c")));
    assertEquals(List.of(), client.filterAccessibleTenants(Optional.empty(), List.of("a")));
  }

  @Test
  void filterAccessibleTenants_authorityFailureDropsCandidate() {
    api.reviewFailure = new AuthorityException(0, "down", null);

    assertEquals(List.of(), client.filterAccessibleTenants(Optional.of("t"), List.of("a", "b")));
  }
}
