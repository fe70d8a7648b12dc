package io.intellixity.tenancy.authz.kubernetes;

/**
 * The Kubernetes API could not answer. {@link #status()} is the HTTP status the API server returned, or
 * {@code 0} when no response was received (connect failure, timeout, TLS failure).
 */
public final class AuthorityException extends RuntimeException {
  private final int status;

  public AuthorityException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public int status() { return status; }

  public boolean hasResponse() { return status > 0; }
}
