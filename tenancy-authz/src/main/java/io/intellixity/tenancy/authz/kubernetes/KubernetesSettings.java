package io.intellixity.tenancy.authz.kubernetes;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings for the Kubernetes API server.\n
 *
 * API server resolution: explicit value, then in-cluster service address when {@code KUBERNETES_SERVICE_HOST} is
 * set, then the current-context cluster of the kubeconfig, then the in-cluster default.
 */
public record KubernetesSettings(String apiServer,
                                 Path caFile,
                                 boolean insecureSkipTlsVerify,
                                 String apiGroup,
                                 Duration reviewTimeout,
                                 Duration listTimeout,
                                 Path serviceAccountTokenFile) {
  public static final String DEFAULT_API_SERVER = "https://kubernetes.default.svc";
  public static final String DEFAULT_API_GROUP = "community.mlflow.org";
  public static final Duration DEFAULT_REVIEW_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_LIST_TIMEOUT = Duration.ofSeconds(5);
  public static final Path IN_CLUSTER_CA_FILE = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/ca.crt");
  public static final Path IN_CLUSTER_TOKEN_FILE = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");

  public KubernetesSettings {
    Objects.requireNonNull(apiServer, "apiServer");
    apiServer = stripTrailingSlash(apiServer);
    if (apiGroup == null || apiGroup.isBlank()) apiGroup = DEFAULT_API_GROUP;
    if (reviewTimeout == null) reviewTimeout = DEFAULT_REVIEW_TIMEOUT;
    if (listTimeout == null) listTimeout = DEFAULT_LIST_TIMEOUT;
    if (serviceAccountTokenFile == null) serviceAccountTokenFile = IN_CLUSTER_TOKEN_FILE;
  }

  public static KubernetesSettings of(String apiServer) {
    return new KubernetesSettings(apiServer, null, false, null, null, null, null);
  }

  /** CA bundle to trust: the explicit file, else the in-cluster bundle when mounted, else none (JVM default). */
  public Optional<Path> effectiveCaFile() {
    if (insecureSkipTlsVerify) return Optional.empty();
    if (caFile != null) return Optional.of(caFile);
    return Files.isRegularFile(IN_CLUSTER_CA_FILE) ? Optional.of(IN_CLUSTER_CA_FILE) : Optional.empty();
  }

  public static String resolveApiServer(String explicit, Map<String, String> env, Path userHome) {
    if (explicit != null && !explicit.isBlank()) return stripTrailingSlash(explicit.trim());
    String serviceHost = env.get("KUBERNETES_SERVICE_HOST");
    if (serviceHost != null && !serviceHost.isBlank()) return DEFAULT_API_SERVER;
    return KubeConfig.discover(env, userHome)
        .map(KubeConfig.CurrentContext::server)
        .filter(s -> !s.isBlank())
        .map(KubernetesSettings::stripTrailingSlash)
        .orElse(DEFAULT_API_SERVER);
  }

  private static String stripTrailingSlash(String s) {
    String out = s;
    while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
