package io.intellixity.tenancy.server.config;

import io.intellixity.tenancy.authz.AuthorizationGateway;
import io.intellixity.tenancy.authz.kubernetes.KubernetesSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tenancy")
public class TenancyProperties {
  private String tenantHeader = AuthorizationGateway.DEFAULT_TENANT_HEADER;
  /** Comma-separated; consulted by discovery only when namespace enumeration returns nothing. */
  private String tenantCandidates = "";
  private final List<String> extraExemptPaths = new ArrayList<>();
  private final Kubernetes kubernetes = new Kubernetes();

  public String getTenantHeader() { return tenantHeader; }
  public void setTenantHeader(String tenantHeader) { this.tenantHeader = tenantHeader; }

  public String getTenantCandidates() { return tenantCandidates; }
  public void setTenantCandidates(String tenantCandidates) { this.tenantCandidates = tenantCandidates; }

  public List<String> getExtraExemptPaths() { return extraExemptPaths; }

  public Kubernetes getKubernetes() { return kubernetes; }

  public static class Kubernetes {
    private String apiServer;
    private String caFile;
    private boolean insecureSkipTlsVerify;
    private String apiGroup = KubernetesSettings.DEFAULT_API_GROUP;
    private Duration reviewTimeout = KubernetesSettings.DEFAULT_REVIEW_TIMEOUT;
    private Duration listTimeout = KubernetesSettings.DEFAULT_LIST_TIMEOUT;
    private Path serviceAccountTokenFile = KubernetesSettings.IN_CLUSTER_TOKEN_FILE;

    public String getApiServer() { return apiServer; }
    public void setApiServer(String apiServer) { this.apiServer = apiServer; }

    public String getCaFile() { return caFile; }
    public void setCaFile(String caFile) { this.caFile = caFile; }

    public boolean isInsecureSkipTlsVerify() { return insecureSkipTlsVerify; }
    public void setInsecureSkipTlsVerify(boolean insecureSkipTlsVerify) { this.insecureSkipTlsVerify = insecureSkipTlsVerify; }

    public String getApiGroup() { return apiGroup; }
    public void setApiGroup(String apiGroup) { this.apiGroup = apiGroup; }

    public Duration getReviewTimeout() { return reviewTimeout; }
    public void setReviewTimeout(Duration reviewTimeout) { this.reviewTimeout = reviewTimeout; }

    public Duration getListTimeout() { return listTimeout; }
    public void setListTimeout(Duration listTimeout) { this.listTimeout = listTimeout; }

    public Path getServiceAccountTokenFile() { return serviceAccountTokenFile; }
    public void setServiceAccountTokenFile(Path serviceAccountTokenFile) { this.serviceAccountTokenFile = serviceAccountTokenFile; }
  }
}
