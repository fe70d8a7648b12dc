package io.intellixity.tenancy.authz.kubernetes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class KubeConfigTest {

  private static final String CONFIG = String.join("\n",
      "apiVersion: v1",
      "kind: Config",
      "current-context: dev",
      "clusters:",
      "- name: prod-cluster",
      "  cluster:",
      "    server: https://prod.example:6443",
      "- name: dev-cluster",
      "  cluster:",
      "    server: https://dev.example:6443/",
      "contexts:",
      "- name: dev",
      "  context:",
      "    cluster: dev-cluster",
      "    user: dev-user",
      "users:",
      "- name: dev-user",
      "  user:",
      "    token: dev-token",
      "");

  @TempDir
  Path dir;

  @Test
  void load_readsCurrentContextClusterAndUser() throws IOException {
    Path file = Files.writeString(dir.resolve("config"), CONFIG);

    Optional<KubeConfig.CurrentContext> ctx = KubeConfig.load(file);

    assertEquals(Optional.of(new KubeConfig.CurrentContext("https://dev.example:6443/", "dev-token")), ctx);
  }

  @Test
  void discover_skipsBrokenFilesAndFallsBackToHome() throws IOException {
    Path broken = Files.writeString(dir.resolve("broken"), "current-context: [unclosed");
    Path home = dir.resolve("home");
    Files.createDirectories(home.resolve(".kube"));
    Files.writeString(home.resolve(".kube").resolve("config"), CONFIG);

    Optional<KubeConfig.CurrentContext> ctx = KubeConfig.discover(Map.of("KUBECONFIG", broken.toString()), home);

    assertEquals("https://dev.example:6443/", ctx.map(KubeConfig.CurrentContext::server).orElse(null));
  }

  @Test
  void load_missingCurrentContextIsEmpty() throws IOException {
    Path file = Files.writeString(dir.resolve("config"), "apiVersion: v1\nclusters: []\n");

    assertTrue(KubeConfig.load(file).isEmpty());
    assertTrue(KubeConfig.load(dir.resolve("absent")).isEmpty());
  }
}
