package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.store.ModelRegistryStore;
import io.intellixity.tenancy.store.TrackingStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public final class HealthController {
  private final TrackingStore tracking;
  private final ModelRegistryStore registry;

  public HealthController(TrackingStore tracking, ModelRegistryStore registry) {
    this.tracking = tracking;
    this.registry = registry;
  }

  @GetMapping("/health")
  public String health() {
    return "OK";
  }

  @GetMapping("/version")
  public Map<String, String> version() {
    String v = HealthController.class.getPackage().getImplementationVersion();
    return Map.of(
        "version", v == null ? "dev" : v,
        "tracking_backend", tracking.backend(),
        "registry_backend", registry.backend());
  }
}
