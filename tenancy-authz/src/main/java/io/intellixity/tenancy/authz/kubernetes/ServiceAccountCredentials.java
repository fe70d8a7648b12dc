package io.intellixity.tenancy.authz.kubernetes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The server's own (elevated) identity, used only to enumerate namespaces.\n
 *
 * The mounted service-account token is re-read on every call because the kubelet rotates it; outside a cluster
 * the kubeconfig user token is used.
 */
public final class ServiceAccountCredentials {
  private static final Logger log = LoggerFactory.getLogger(ServiceAccountCredentials.class);

  private final Path tokenFile;
  private final Supplier<Optional<String>> fallback;

  public ServiceAccountCredentials(Path tokenFile, Supplier<Optional<String>> fallback) {
    this.tokenFile = tokenFile;
    this.fallback = fallback == null ? Optional::empty : fallback;
  }

  public static ServiceAccountCredentials of(String token) {
    return new ServiceAccountCredentials(null, () -> Optional.ofNullable(token));
  }

  public Optional<String> token() {
    if (tokenFile != null && Files.isRegularFile(tokenFile)) {
      try {
        String token = Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
        if (!token.isEmpty()) return Optional.of(token);
      } catch (IOException e) {
        log.warn("tenancy.k8s serviceAccountToken={} unreadable: {}", tokenFile, e.getMessage());
      }
    }
    return fallback.get().filter(t -> !t.isBlank());
  }
}
