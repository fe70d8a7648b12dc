package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.TenantContext;

import java.util.Objects;

/**
 * Terminal result of the gateway: {@link GatewayState#EXEMPT}, {@link GatewayState#AUTHORIZED} with the tenant
 * context to bind, or {@link GatewayState#DENIED} with the outward error code and message.
 */
public record GatewayDecision(GatewayState state,
                              TenantContext context,
                              Classification classification,
                              ErrorCode errorCode,
                              String message) {
  public GatewayDecision {
    Objects.requireNonNull(state, "state");
  }

  public static GatewayDecision exempt() {
    return new GatewayDecision(GatewayState.EXEMPT, null, null, null, null);
  }

  public static GatewayDecision authorized(TenantContext context, Classification classification) {
    Objects.requireNonNull(context, "context");
    return new GatewayDecision(GatewayState.AUTHORIZED, context, classification, null, null);
  }

  public static GatewayDecision denied(ErrorCode errorCode, String message) {
    Objects.requireNonNull(errorCode, "errorCode");
    return new GatewayDecision(GatewayState.DENIED, null, null, errorCode, message);
  }

  public boolean proceeds() {
    return state != GatewayState.DENIED;
  }

  public int httpStatus() {
    return errorCode == null ? 200 : errorCode.httpStatus();
  }
}
