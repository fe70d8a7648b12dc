package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.authz.ExemptPaths;
import io.intellixity.tenancy.authz.TenantDiscovery;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** Lists the namespaces the caller may use. The path is exempt from the tenant header requirement. */
@RestController
public final class NamespaceController {
  private final TenantDiscovery discovery;

  public NamespaceController(TenantDiscovery discovery) {
    this.discovery = discovery;
  }

  @GetMapping(ExemptPaths.NAMESPACES_PATH)
  public Map<String, List<String>> namespaces(HttpServletRequest request) {
    return Map.of("namespaces", discovery.discover(new ServletInboundRequest(request)));
  }
}
