package io.b2mash.orgguard.context;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Request-scoped organization context. Bound once by the access guard and read by handlers; the
 * binding lives and dies with the servlet request.
 */
public final class RequestScopes {

  static final String ORGANIZATION_CONTEXT =
      RequestScopes.class.getName() + ".ORGANIZATION_CONTEXT";

  public static void bind(HttpServletRequest request, OrganizationContext context) {
    request.setAttribute(ORGANIZATION_CONTEXT, context);
  }

  /** Returns the bound context, or empty if the request has not been through the guard. */
  public static Optional<OrganizationContext> currentContext(HttpServletRequest request) {
    Object value = request.getAttribute(ORGANIZATION_CONTEXT);
    return value instanceof OrganizationContext context ? Optional.of(context) : Optional.empty();
  }

  /** Returns the bound context. Throws if the guard did not run for this request. */
  public static OrganizationContext requireContext(HttpServletRequest request) {
    return currentContext(request).orElseThrow(OrganizationContextNotBoundException::new);
  }

  private RequestScopes() {}
}
