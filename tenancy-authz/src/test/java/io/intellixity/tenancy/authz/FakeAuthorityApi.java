package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.authz.kubernetes.AuthorityException;
import io.intellixity.tenancy.authz.kubernetes.KubernetesAuthorityApi;
import io.intellixity.tenancy.authz.kubernetes.ResourceAttributes;
import io.intellixity.tenancy.authz.kubernetes.ReviewStatus;

import java.util.*;

/** Grants are "token|namespace|resource|verb" strings; anything else is denied with {@link #denyReason}. */
final class FakeAuthorityApi implements KubernetesAuthorityApi {
  final Set<String> grants = new HashSet<>();
  final List<ResourceAttributes> reviews = new ArrayList<>();
  final Map<String, String> usernames = new HashMap<>();
  List<String> namespaces = List.of();
  String denyReason = "no RBAC policy matched";
  AuthorityException reviewFailure;
  AuthorityException listFailure;
  String lastListToken;

  FakeAuthorityApi grant(String token, String namespace, String resource, String verb) {
    grants.add(token + "|" + namespace + "|" + resource + "|" + verb);
    return this;
  }

  @Override
  public ReviewStatus selfSubjectAccessReview(String token, ResourceAttributes attributes) {
    reviews.add(attributes);
    if (reviewFailure != null) throw reviewFailure;
    String key = token + "|" + attributes.namespace() + "|" + attributes.resource() + "|" + attributes.verb();
    return grants.contains(key) ? new ReviewStatus(true, null) : new ReviewStatus(false, denyReason);
  }

  @Override
  public List<String> listNamespaces(String token) {
    lastListToken = token;
    if (listFailure != null) throw listFailure;
    return namespaces;
  }

  @Override
  public Optional<String> selfSubjectUsername(String token) {
    return Optional.ofNullable(usernames.get(token));
  }
}
