package io.intellixity.tenancy.authz;

/** Progress of one request through {@link AuthorizationGateway}. */
public enum GatewayState {
  UNCHECKED,
  EXEMPT,
  TENANT_VALIDATED,
  CLASSIFIED,
  AUTHORIZED,
  DENIED
}
