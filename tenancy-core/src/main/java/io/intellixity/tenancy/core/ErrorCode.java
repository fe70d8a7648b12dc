package io.intellixity.tenancy.core;

/** Coarse-grained outward error codes and the HTTP status each one maps to. */
public enum ErrorCode {
  INVALID_PARAMETER_VALUE(400),
  UNAUTHENTICATED(401),
  PERMISSION_DENIED(403),
  RESOURCE_DOES_NOT_EXIST(404),
  RESOURCE_ALREADY_EXISTS(400),
  INTERNAL_ERROR(500),
  NOT_IMPLEMENTED(501);

  private final int httpStatus;

  ErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
