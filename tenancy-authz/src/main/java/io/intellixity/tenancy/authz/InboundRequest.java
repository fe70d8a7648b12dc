package io.intellixity.tenancy.authz;

/**
 * The parts of an inbound HTTP request the gateway reads. Header and cookie lookups return {@code null} when
 * absent; header names are matched case-insensitively by implementations.
 */
public interface InboundRequest {
  String path();

  String method();

  String header(String name);

  String cookie(String name);
}
