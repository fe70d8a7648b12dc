package io.intellixity.tenancy.authz.kubernetes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link KubernetesAuthorityApi} over the plain Kubernetes REST API using Spring's {@link RestClient}.\n
 *
 * Reviews and listings use separate clients so each carries its own read timeout.
 */
public final class RestKubernetesAuthorityApi implements KubernetesAuthorityApi {
  private static final Logger log = LoggerFactory.getLogger(RestKubernetesAuthorityApi.class);

  static final String ACCESS_REVIEW_PATH = "/apis/authorization.k8s.io/v1/selfsubjectaccessreviews";
  static final String NAMESPACES_PATH = "/api/v1/namespaces";
  static final String SUBJECT_REVIEW_PATH = "/apis/authentication.k8s.io/v1/selfsubjectreviews";

  private final RestClient reviewClient;
  private final RestClient listClient;

  public RestKubernetesAuthorityApi(RestClient reviewClient, RestClient listClient) {
    this.reviewClient = Objects.requireNonNull(reviewClient, "reviewClient");
    this.listClient = Objects.requireNonNull(listClient, "listClient");
  }

  public static RestKubernetesAuthorityApi create(KubernetesSettings settings) {
    HttpClient http = KubernetesTls.httpClient(settings);
    log.info("tenancy.k8s apiServer={} tlsVerify={}", settings.apiServer(), !settings.insecureSkipTlsVerify());
    return new RestKubernetesAuthorityApi(
        client(settings.apiServer(), http, settings.reviewTimeout()),
        client(settings.apiServer(), http, settings.listTimeout()));
  }

  private static RestClient client(String baseUrl, HttpClient http, Duration readTimeout) {
    JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(http);
    factory.setReadTimeout(readTimeout);
    return RestClient.builder().baseUrl(baseUrl).requestFactory(factory).build();
  }

  @Override
  public ReviewStatus selfSubjectAccessReview(String token, ResourceAttributes attributes) {
    AccessReview request = new AccessReview("authorization.k8s.io/v1", "SelfSubjectAccessReview",
        new AccessReviewSpec(attributes), null);
    AccessReview response = call("selfSubjectAccessReview", () -> reviewClient.post()
        .uri(ACCESS_REVIEW_PATH)
        .header(HttpHeaders.AUTHORIZATION, bearer(token))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .body(request)
        .retrieve()
        .body(AccessReview.class));
    if (response == null || response.status() == null) return new ReviewStatus(false, null);
    return new ReviewStatus(response.status().allowed(), response.status().reason());
  }

  @Override
  public List<String> listNamespaces(String token) {
    NamespaceList response = call("listNamespaces", () -> listClient.get()
        .uri(NAMESPACES_PATH)
        .header(HttpHeaders.AUTHORIZATION, bearer(token))
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(NamespaceList.class));
    List<String> out = new ArrayList<>();
    if (response == null || response.items() == null) return out;
    for (NamespaceItem item : response.items()) {
      if (item != null && item.metadata() != null && item.metadata().name() != null) out.add(item.metadata().name());
    }
    return out;
  }

  @Override
  public Optional<String> selfSubjectUsername(String token) {
    SubjectReview request = new SubjectReview("authentication.k8s.io/v1", "SelfSubjectReview", null);
    SubjectReview response = call("selfSubjectReview", () -> reviewClient.post()
        .uri(SUBJECT_REVIEW_PATH)
        .header(HttpHeaders.AUTHORIZATION, bearer(token))
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .body(request)
        .retrieve()
        .body(SubjectReview.class));
    if (response == null || response.status() == null || response.status().userInfo() == null) return Optional.empty();
    String username = response.status().userInfo().username();
    return username == null || username.isBlank() ? Optional.empty() : Optional.of(username);
  }

  private static String bearer(String token) {
    return "Bearer " + token;
  }

  private static <T> T call(String op, Supplier<T> exchange) {
    try {
      return exchange.get();
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      throw new AuthorityException(status, "Kubernetes API " + op + " returned " + status, e);
    } catch (ResourceAccessException e) {
      throw new AuthorityException(0, "Kubernetes API " + op + " unreachable: " + e.getMessage(), e);
    } catch (RestClientException e) {
      throw new AuthorityException(0, "Kubernetes API " + op + " failed: " + e.getMessage(), e);
    }
  }

  // ---------- wire types ----------

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record AccessReview(String apiVersion, String kind, AccessReviewSpec spec, AccessReviewStatus status) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record AccessReviewSpec(ResourceAttributes resourceAttributes) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AccessReviewStatus(boolean allowed, String reason) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NamespaceList(List<NamespaceItem> items) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NamespaceItem(ObjectMeta metadata) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ObjectMeta(String name) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record SubjectReview(String apiVersion, String kind, SubjectReviewStatus status) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SubjectReviewStatus(UserInfo userInfo) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record UserInfo(String username) {}
}
