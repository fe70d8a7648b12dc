package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.TenancyException;
import io.intellixity.tenancy.store.MetadataStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Renders isolation and store failures raised inside handlers with the same payload the filter uses. */
@RestControllerAdvice
public class TenancyExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(TenancyExceptionHandler.class);

  @ExceptionHandler(TenancyException.class)
  public ResponseEntity<ErrorBody> handleTenancy(TenancyException ex) {
    log.info("tenancy.web code={} message={}", ex.errorCode(), ex.getMessage());
    return body(ex.errorCode(), ex.getMessage());
  }

  @ExceptionHandler(MetadataStoreException.class)
  public ResponseEntity<ErrorBody> handleStore(MetadataStoreException ex) {
    log.debug("tenancy.web store code={} message={}", ex.errorCode(), ex.getMessage());
    return body(ex.errorCode(), ex.getMessage());
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ErrorBody> handleBadRequest(Exception ex) {
    return body(ErrorCode.INVALID_PARAMETER_VALUE, ex.getMessage());
  }

  private static ResponseEntity<ErrorBody> body(ErrorCode code, String message) {
    return ResponseEntity.status(code.httpStatus()).body(ErrorBody.of(code, message));
  }
}
