package io.intellixity.tenancy.authz.kubernetes;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.ConnectException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

final class RestKubernetesAuthorityApiTest {

  private static final String BASE = "https://k8s.test:6443";

  private MockRestServiceServer server;
  private RestKubernetesAuthorityApi api;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
    server = MockRestServiceServer.bindTo(builder).build();
    RestClient client = builder.build();
    api = new RestKubernetesAuthorityApi(client, client);
  }

  private static String body(org.springframework.http.client.ClientHttpRequest request) throws IOException {
    return ((MockClientHttpRequest) request).getBodyAsString();
  }

  @Test
  void selfSubjectAccessReview_postsResourceAttributesWithCallerToken() {
    server.expect(requestTo(BASE + RestKubernetesAuthorityApi.ACCESS_REVIEW_PATH))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer caller-token"))
        .andExpect(request -> {
          String json = body(request);
          assertTrue(json.contains("\"kind\":\"SelfSubjectAccessReview\""), json);
          assertTrue(json.contains("\"group\":\"community.mlflow.org\""), json);
          assertTrue(json.contains("\"resource\":\"experiments\""), json);
          assertTrue(json.contains("\"verb\":\"create\""), json);
          assertTrue(json.contains("\"namespace\":\"team-a\""), json);
          assertFalse(json.contains("\"status\""), json);
        })
        .andRespond(withSuccess("{\"kind\":\"SelfSubjectAccessReview\",\"status\":{\"allowed\":false,"
            + "\"reason\":\"no binding\",\"evaluationError\":\"\"}}", MediaType.APPLICATION_JSON));

    ReviewStatus status = api.selfSubjectAccessReview("caller-token",
        new ResourceAttributes("community.mlflow.org", "experiments", "create", "team-a"));

    assertFalse(status.allowed());
    assertEquals("no binding", status.reason());
    server.verify();
  }

  @Test
  void selfSubjectAccessReview_statusErrorsCarryHttpStatus() {
    server.expect(requestTo(BASE + RestKubernetesAuthorityApi.ACCESS_REVIEW_PATH))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    AuthorityException ex = assertThrows(AuthorityException.class, () -> api.selfSubjectAccessReview("bad",
        new ResourceAttributes("g", "models", "get", "team-a")));

    assertEquals(401, ex.status());
    assertTrue(ex.hasResponse());
  }

  @Test
  void transportFailure_hasNoStatus() {
    server.expect(requestTo(BASE + RestKubernetesAuthorityApi.NAMESPACES_PATH))
        .andRespond(withException(new ConnectException("Connection refused")));

    AuthorityException ex = assertThrows(AuthorityException.class, () -> api.listNamespaces("sa"));

    assertEquals(0, ex.status());
    assertFalse(ex.hasResponse());
  }

  @Test
  void listNamespaces_readsMetadataNames() {
    server.expect(requestTo(BASE + RestKubernetesAuthorityApi.NAMESPACES_PATH))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer sa"))
        .andRespond(withSuccess("{\"kind\":\"NamespaceList\",\"items\":["
            + "{\"metadata\":{\"name\":\"team-a\",\"uid\":\"1\"}},"
            + "{\"metadata\":{\"name\":\"kube-system\"}},"
            + "{\"metadata\":{}}]}", MediaType.APPLICATION_JSON));

    assertEquals(List.of("team-a", "kube-system"), api.listNamespaces("sa"));
  }

  @Test
  void selfSubjectUsername_readsUserInfo() {
    server.expect(requestTo(BASE + RestKubernetesAuthorityApi.SUBJECT_REVIEW_PATH))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withSuccess("{\"status\":{\"userInfo\":{\"username\":\"ana@example.com\",\"groups\":[\"dev\"]}}}",
            MediaType.APPLICATION_JSON));

    assertEquals(Optional.of("ana@example.com"), api.selfSubjectUsername("t"));
  }
}
