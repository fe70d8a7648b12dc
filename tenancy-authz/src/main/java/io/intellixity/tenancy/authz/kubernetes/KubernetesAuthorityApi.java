package io.intellixity.tenancy.authz.kubernetes;

import java.util.List;
import java.util.Optional;

/**
 * The three Kubernetes API calls the authorization layer needs. Every call runs with the token it is given;
 * implementations hold no credential of their own.
 */
public interface KubernetesAuthorityApi {

  /** {@code POST /apis/authorization.k8s.io/v1/selfsubjectaccessreviews} as the token's subject. */
  ReviewStatus selfSubjectAccessReview(String token, ResourceAttributes attributes);

  /** {@code GET /api/v1/namespaces}; names in server order. */
  List<String> listNamespaces(String token);

  /** {@code POST /apis/authentication.k8s.io/v1/selfsubjectreviews}; the username, when the server reports one. */
  Optional<String> selfSubjectUsername(String token);
}
