package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.core.ErrorCode;

/** Outward error payload, serialized as {@code {"error_code": ..., "message": ...}}. */
public record ErrorBody(String errorCode, String message) {
  public static ErrorBody of(ErrorCode code, String message) {
    return new ErrorBody(code.name(), message);
  }
}
