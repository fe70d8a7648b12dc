package io.intellixity.tenancy.authz.kubernetes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class KubernetesSettingsTest {

  @TempDir
  Path dir;

  @Test
  void resolveApiServer_explicitWins() {
    assertEquals("https://api.example:6443",
        KubernetesSettings.resolveApiServer("https://api.example:6443/", Map.of("KUBERNETES_SERVICE_HOST", "10.0.0.1"), dir));
  }

  @Test
  void resolveApiServer_inClusterBeforeKubeconfig() throws IOException {
    Path kubeconfig = Files.writeString(dir.resolve("kc"), "current-context: c\ncontexts:\n- name: c\n  context:\n    cluster: k\n"
        + "clusters:\n- name: k\n  cluster:\n    server: https://from-kubeconfig\n");

    assertEquals(KubernetesSettings.DEFAULT_API_SERVER, KubernetesSettings.resolveApiServer(null,
        Map.of("KUBERNETES_SERVICE_HOST", "10.0.0.1", "KUBECONFIG", kubeconfig.toString()), dir));
    assertEquals("https://from-kubeconfig",
        KubernetesSettings.resolveApiServer(" ", Map.of("KUBECONFIG", kubeconfig.toString()), dir));
  }

  @Test
  void resolveApiServer_defaultsToServiceAddress() {
    assertEquals(KubernetesSettings.DEFAULT_API_SERVER, KubernetesSettings.resolveApiServer(null, Map.of(), dir));
  }

  @Test
  void defaults_fillGroupAndTimeouts() {
    KubernetesSettings s = KubernetesSettings.of("https://k8s/");

    assertEquals("https://k8s", s.apiServer());
    assertEquals("community.mlflow.org", s.apiGroup());
    assertEquals(Duration.ofSeconds(10), s.reviewTimeout());
    assertEquals(Duration.ofSeconds(5), s.listTimeout());
  }

  @Test
  void effectiveCaFile_insecureDisablesExplicitFile() {
    Path ca = dir.resolve("ca.crt");
    KubernetesSettings explicit = new KubernetesSettings("https://k8s", ca, false, null, null, null, null);
    KubernetesSettings insecure = new KubernetesSettings("https://k8s", ca, true, null, null, null, null);

    assertEquals(Optional.of(ca), explicit.effectiveCaFile());
    assertEquals(Optional.empty(), insecure.effectiveCaFile());
  }

  @Test
  void serviceAccountToken_rereadFromFileThenFallback() throws IOException {
    Path token = Files.writeString(dir.resolve("token"), "first\n");
    ServiceAccountCredentials sa = new ServiceAccountCredentials(token, () -> Optional.of("fallback"));

    assertEquals(Optional.of("first"), sa.token());
    Files.writeString(token, "rotated");
    assertEquals(Optional.of("rotated"), sa.token());
    Files.delete(token);
    assertEquals(Optional.of("fallback"), sa.token());
  }
}
