package io.intellixity.tenancy.server.config;

import io.intellixity.tenancy.authz.*;
import io.intellixity.tenancy.authz.kubernetes.*;
import io.intellixity.tenancy.core.Tenancy;
import io.intellixity.tenancy.isolation.TenantScopedModelRegistryStore;
import io.intellixity.tenancy.isolation.TenantScopedTrackingStore;
import io.intellixity.tenancy.store.ModelRegistryStore;
import io.intellixity.tenancy.store.TrackingStore;
import io.intellixity.tenancy.store.memory.InMemoryModelRegistryStore;
import io.intellixity.tenancy.store.memory.InMemoryTrackingStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(TenancyProperties.class)
public class TenancyServerConfig {

  @Bean
  public KubernetesSettings kubernetesSettings(TenancyProperties props) {
    TenancyProperties.Kubernetes k = props.getKubernetes();
    String apiServer = KubernetesSettings.resolveApiServer(
        k.getApiServer(), System.getenv(), Path.of(System.getProperty("user.home")));
    Path caFile = k.getCaFile() == null || k.getCaFile().isBlank() ? null : Path.of(k.getCaFile().trim());
    return new KubernetesSettings(apiServer, caFile, k.isInsecureSkipTlsVerify(), k.getApiGroup(),
        k.getReviewTimeout(), k.getListTimeout(), k.getServiceAccountTokenFile());
  }

  @Bean
  public KubernetesAuthorityApi kubernetesAuthorityApi(KubernetesSettings settings) {
    return RestKubernetesAuthorityApi.create(settings);
  }

  @Bean
  public ServiceAccountCredentials serviceAccountCredentials(KubernetesSettings settings) {
    Path home = Path.of(System.getProperty("user.home"));
    return new ServiceAccountCredentials(settings.serviceAccountTokenFile(),
        () -> KubeConfig.discover(System.getenv(), home).map(KubeConfig.CurrentContext::token));
  }

  @Bean
  public AccessReviewClient accessReviewClient(KubernetesAuthorityApi api,
                                               ServiceAccountCredentials serviceAccount,
                                               KubernetesSettings settings) {
    return new AccessReviewClient(api, serviceAccount, settings.apiGroup());
  }

  @Bean
  public AuthorizationGateway authorizationGateway(TenancyProperties props,
                                                   AccessReviewClient reviews,
                                                   KubernetesAuthorityApi api) {
    return new AuthorizationGateway(new ExemptPaths(props.getExtraExemptPaths()), props.getTenantHeader(),
        reviews, new UserResolver(api));
  }

  @Bean
  public TenantDiscovery tenantDiscovery(TenancyProperties props, AccessReviewClient reviews) {
    return new TenantDiscovery(reviews, props.getTenantHeader(),
        TenantDiscovery.parseCandidates(props.getTenantCandidates()));
  }

  // The in-memory stores are the default backing stores; every consumer sees only the tenant-scoped views.

  @Bean
  public TrackingStore trackingStore() {
    return new TenantScopedTrackingStore(new InMemoryTrackingStore(), Tenancy.scope());
  }

  @Bean
  public ModelRegistryStore modelRegistryStore() {
    return new TenantScopedModelRegistryStore(new InMemoryModelRegistryStore(), Tenancy.scope());
  }
}
