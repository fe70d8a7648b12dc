package io.intellixity.tenancy.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tenancy.authz.AuthorizationGateway;
import io.intellixity.tenancy.authz.GatewayDecision;
import io.intellixity.tenancy.authz.GatewayState;
import io.intellixity.tenancy.core.Tenancy;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs the authorization gateway before any handler and binds the resulting tenant context for the rest of the
 * request. Denials are answered here and never reach a controller or a store.
 */
@Component
public final class TenantAuthorizationFilter extends OncePerRequestFilter {
  private final AuthorizationGateway gateway;
  private final ObjectMapper json;

  public TenantAuthorizationFilter(AuthorizationGateway gateway, ObjectMapper json) {
    this.gateway = gateway;
    this.json = json;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    GatewayDecision decision = gateway.evaluate(new ServletInboundRequest(request));
    if (decision.state() == GatewayState.EXEMPT) {
      filterChain.doFilter(request, response);
      return;
    }
    if (!decision.proceeds()) {
      response.setStatus(decision.httpStatus());
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      json.writeValue(response.getOutputStream(), ErrorBody.of(decision.errorCode(), decision.message()));
      return;
    }

    try {
      Tenancy.inContext(decision.context(), () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (IOException | ServletException e) {
          throw new FilterChainFailure(e);
        }
        return null;
      });
    } catch (FilterChainFailure e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      throw (ServletException) c;
    }
  }

  private static final class FilterChainFailure extends RuntimeException {
    FilterChainFailure(Exception cause) {
      super(cause);
    }
  }
}
