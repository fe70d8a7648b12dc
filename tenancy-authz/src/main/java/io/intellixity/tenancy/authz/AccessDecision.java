package io.intellixity.tenancy.authz;

import io.intellixity.tenancy.core.ErrorCode;

import java.util.Objects;

/**
 * Outcome of one delegated access review. Never carries an exception: authority failures are folded into
 * {@link Outcome#UNAVAILABLE}, which callers treat as a denial.
 */
public record AccessDecision(Outcome outcome, String reason) {

  public enum Outcome {
    ALLOWED,
    DENIED,
    UNAUTHENTICATED,
    UNAVAILABLE
  }

  public AccessDecision {
    Objects.requireNonNull(outcome, "outcome");
  }

  public static AccessDecision allowed() {
    return new AccessDecision(Outcome.ALLOWED, null);
  }

  public static AccessDecision denied(String reason) {
    return new AccessDecision(Outcome.DENIED, reason);
  }

  public static AccessDecision unauthenticated(String reason) {
    return new AccessDecision(Outcome.UNAUTHENTICATED, reason);
  }

  public static AccessDecision unavailable(String reason) {
    return new AccessDecision(Outcome.UNAVAILABLE, reason);
  }

  public boolean isAllowed() {
    return outcome == Outcome.ALLOWED;
  }

  /** Outward error code: unauthenticated stays distinct, everything else not allowed is a denial. */
  public ErrorCode errorCode() {
    return outcome == Outcome.UNAUTHENTICATED ? ErrorCode.UNAUTHENTICATED : ErrorCode.PERMISSION_DENIED;
  }
}
