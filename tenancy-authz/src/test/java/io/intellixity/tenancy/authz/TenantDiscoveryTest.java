package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.authz.kubernetes.ServiceAccountCredentials;
import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.TenancyException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TenantDiscoveryTest {

  private final FakeAuthorityApi api = new FakeAuthorityApi();
  private final AccessReviewClient reviews =
      new AccessReviewClient(api, ServiceAccountCredentials.of("sa"), "community.mlflow.org");

  @Test
  void discover_unionsDeclaredTenantAndFiltersByCallerGrants() {
    api.namespaces = List.of("a", "b");
    api.grant("t", "a", "experiments", "list").grant("t", "c", "models", "list");
    TenantDiscovery discovery = new TenantDiscovery(reviews, "X-MLflow-Namespace", List.of("z"));

    List<String> tenants = discovery.discover(FakeRequest.get(ExemptPaths.NAMESPACES_PATH).tenant("c").bearer("t"));

    assertEquals(List.of("a", "c"), tenants);
  }

  @Test
  void discover_staticCandidatesOnlyWhenEnumerationIsEmpty() {
    api.grant("t", "x", "experiments", "list").grant("t", "a", "experiments", "list");
    TenantDiscovery discovery = new TenantDiscovery(reviews, "X-MLflow-Namespace", List.of("x", "y"));

    assertEquals(List.of("x"), discovery.discover(FakeRequest.get("/ns").bearer("t")));

    api.namespaces = List.of("a");
    assertEquals(List.of("a"), discovery.discover(FakeRequest.get("/ns").bearer("t")));
  }

  @Test
  void discover_nothingAccessibleIsDenied() {
    api.namespaces = List.of("a", "b");
    TenantDiscovery discovery = new TenantDiscovery(reviews, "X-MLflow-Namespace", List.of());

    TenancyException ex = assertThrows(TenancyException.class, () -> discovery.discover(FakeRequest.get("/ns")));

    assertEquals(ErrorCode.PERMISSION_DENIED, ex.errorCode());
    assertEquals("No accessible namespaces for the provided token.", ex.getMessage());
  }

  @Test
  void parseCandidates_trimsAndDropsBlanks() {
    assertEquals(List.of("a", "b"), TenantDiscovery.parseCandidates(" a, ,b,a "));
    assertEquals(List.of(), TenantDiscovery.parseCandidates(null));
  }
}
