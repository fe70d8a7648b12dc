package io.intellixity.tenancy.core;

import java.util.Objects;

/**
 * Raised when a request or a store call crosses the tenant boundary, or when tenant identity is malformed.
 * <p>
 * Isolation violations detected inside the store decorators are always {@link ErrorCode#PERMISSION_DENIED}.
 */
public final class TenancyException extends RuntimeException {
  private final ErrorCode errorCode;

  public TenancyException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  public ErrorCode errorCode() { return errorCode; }

  public static TenancyException invalidParameter(String message) {
    return new TenancyException(ErrorCode.INVALID_PARAMETER_VALUE, message);
  }

  public static TenancyException unauthenticated(String message) {
    return new TenancyException(ErrorCode.UNAUTHENTICATED, message);
  }

  public static TenancyException permissionDenied(String message) {
    return new TenancyException(ErrorCode.PERMISSION_DENIED, message);
  }
}
