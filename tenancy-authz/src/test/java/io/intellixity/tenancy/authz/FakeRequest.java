package io.intellixity.tenancy.authz;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

final class FakeRequest implements InboundRequest {
  private final String method;
  private final String path;
  private final Map<String, String> headers = new HashMap<>();
  private final Map<String, String> cookies = new HashMap<>();

  FakeRequest(String method, String path) {
    this.method = method;
    this.path = path;
  }

  static FakeRequest get(String path) { return new FakeRequest("GET", path); }

  static FakeRequest post(String path) { return new FakeRequest("POST", path); }

  FakeRequest header(String name, String value) {
    headers.put(name.toLowerCase(Locale.ROOT), value);
    return this;
  }

  FakeRequest cookie(String name, String value) {
    cookies.put(name, value);
    return this;
  }

  FakeRequest tenant(String tenant) { return header("X-MLflow-Namespace", tenant); }

  FakeRequest bearer(String token) { return header("Authorization", "Bearer " + token); }

  @Override public String path() { return path; }
  @Override public String method() { return method; }
  @Override public String header(String name) { return headers.get(name.toLowerCase(Locale.ROOT)); }
  @Override public String cookie(String name) { return cookies.get(name); }
}
