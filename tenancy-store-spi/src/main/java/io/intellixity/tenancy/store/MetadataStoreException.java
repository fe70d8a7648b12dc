package io.intellixity.tenancy.store;

import io.intellixity.tenancy.core.ErrorCode;

import java.util.Objects;

/** Failure raised by a backing metadata store. The isolation layer passes it through unchanged. */
public class MetadataStoreException extends RuntimeException {
  private final ErrorCode errorCode;

  public MetadataStoreException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  public MetadataStoreException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
  }

  public ErrorCode errorCode() { return errorCode; }

  public static MetadataStoreException notFound(String message) {
    return new MetadataStoreException(ErrorCode.RESOURCE_DOES_NOT_EXIST, message);
  }

  public static MetadataStoreException alreadyExists(String message) {
    return new MetadataStoreException(ErrorCode.RESOURCE_ALREADY_EXISTS, message);
  }

  public static MetadataStoreException invalidParameter(String message) {
    return new MetadataStoreException(ErrorCode.INVALID_PARAMETER_VALUE, message);
  }
}
