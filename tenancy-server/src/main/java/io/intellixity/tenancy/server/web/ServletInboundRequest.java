package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.authz.InboundRequest;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

/** {@link InboundRequest} view of a servlet request; the path excludes the context path. */
final class ServletInboundRequest implements InboundRequest {
  private final HttpServletRequest request;

  ServletInboundRequest(HttpServletRequest request) {
    this.request = request;
  }

  @Override
  public String path() {
    String uri = request.getRequestURI();
    String ctx = request.getContextPath();
    if (ctx != null && !ctx.isEmpty() && uri.startsWith(ctx)) uri = uri.substring(ctx.length());
    return uri.isEmpty() ? "/" : uri;
  }

  @Override
  public String method() {
    return request.getMethod();
  }

  @Override
  public String header(String name) {
    return request.getHeader(name);
  }

  @Override
  public String cookie(String name) {
    Cookie[] cookies = request.getCookies();
    if (cookies == null) return null;
    for (Cookie c : cookies) {
      if (name.equals(c.getName())) return c.getValue();
    }
    return null;
  }
}
