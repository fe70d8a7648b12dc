package io.intellixity.tenancy.authz.kubernetes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal kubeconfig reader: the cluster server and user token of the {@code current-context}.\n
 *
 * Files are tried in {@code KUBECONFIG} order, then {@code ~/.kube/config}; the first file with a usable current
 * context wins. Unreadable or malformed files are skipped.
 */
public final class KubeConfig {
  private static final Logger log = LoggerFactory.getLogger(KubeConfig.class);
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  public record CurrentContext(String server, String token) {}

  private KubeConfig() {}

  public static Optional<CurrentContext> discover(Map<String, String> env, Path userHome) {
    for (Path p : candidates(env, userHome)) {
      Optional<CurrentContext> ctx = load(p);
      if (ctx.isPresent()) return ctx;
    }
    return Optional.empty();
  }

  static List<Path> candidates(Map<String, String> env, Path userHome) {
    List<Path> out = new ArrayList<>();
    String kubeconfig = env.get("KUBECONFIG");
    if (kubeconfig != null && !kubeconfig.isBlank()) {
      for (String part : kubeconfig.split(File.pathSeparator)) {
        if (!part.isBlank()) out.add(Path.of(part.trim()));
      }
    }
    if (userHome != null) out.add(userHome.resolve(".kube").resolve("config"));
    return out;
  }

  public static Optional<CurrentContext> load(Path file) {
    if (!Files.isRegularFile(file)) return Optional.empty();
    JsonNode root;
    try {
      root = YAML.readTree(file.toFile());
    } catch (IOException e) {
      log.debug("tenancy.k8s kubeconfig={} unreadable: {}", file, e.getMessage());
      return Optional.empty();
    }
    if (root == null) return Optional.empty();
    String current = text(root.get("current-context"));
    if (current == null) return Optional.empty();

    JsonNode context = named(root.get("contexts"), current).map(n -> n.get("context")).orElse(null);
    if (context == null) return Optional.empty();
    String server = named(root.get("clusters"), text(context.get("cluster")))
        .map(n -> n.path("cluster").get("server"))
        .map(KubeConfig::text)
        .orElse(null);
    if (server == null) return Optional.empty();
    String token = named(root.get("users"), text(context.get("user")))
        .map(n -> n.path("user").get("token"))
        .map(KubeConfig::text)
        .orElse(null);
    return Optional.of(new CurrentContext(server, token));
  }

  private static Optional<JsonNode> named(JsonNode list, String name) {
    if (list == null || !list.isArray() || name == null) return Optional.empty();
    for (JsonNode n : list) {
      if (name.equals(text(n.get("name")))) return Optional.of(n);
    }
    return Optional.empty();
  }

  private static String text(JsonNode n) {
    if (n == null || !n.isTextual()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s;
  }
}
