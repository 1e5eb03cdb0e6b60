package io.b2mash.orgguard.guard;

import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.context.OrganizationContextResolver;
import io.b2mash.orgguard.context.RequestScopes;
import io.b2mash.orgguard.exception.ForbiddenException;
import io.b2mash.orgguard.exception.UnauthenticatedException;
import io.b2mash.orgguard.rbac.AccessRequirement;
import io.b2mash.orgguard.security.SessionProvider;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Server-side enforcement. Runs strictly in order: resolve the organization context (once per
 * request), evaluate the requirement against the resolved role, then hand the context to the
 * protected operation. Any failure throws before the operation is invoked.
 */
@Component
public class AccessGuard {

  private final SessionProvider sessionProvider;
  private final OrganizationHintExtractor hintExtractor;
  private final OrganizationContextResolver resolver;

  public AccessGuard(
      SessionProvider sessionProvider,
      OrganizationHintExtractor hintExtractor,
      OrganizationContextResolver resolver) {
    this.sessionProvider = sessionProvider;
    this.hintExtractor = hintExtractor;
    this.resolver = resolver;
  }

  /**
   * Wraps {@code operation} so that it only runs for callers meeting {@code requirement}. The
   * returned handler may be invoked once per request.
   */
  public <T> Function<HttpServletRequest, T> protect(
      AccessRequirement requirement, Function<OrganizationContext, T> operation) {
    return request -> operation.apply(authorize(request, requirement));
  }

  /**
   * Resolves (or reuses) the request's organization context and checks {@code requirement} against
   * it.
   *
   * @throws UnauthenticatedException if there is no verified session
   * @throws io.b2mash.orgguard.exception.MissingOrganizationContextException if no hint resolves
   * @throws io.b2mash.orgguard.exception.NotAMemberException if the subject is not a member
   * @throws ForbiddenException if the resolved role fails the requirement
   */
  public OrganizationContext authorize(HttpServletRequest request, AccessRequirement requirement) {
    OrganizationContext context = resolveOnce(request);
    check(context, requirement);
    return context;
  }

  /** Evaluates an already-resolved context. Useful for additional in-handler checks. */
  public void check(OrganizationContext context, AccessRequirement requirement) {
    Optional<AccessRequirement> unmet = requirement.firstUnmet(context.role());
    if (unmet.isPresent()) {
      throw new ForbiddenException(unmet.get().deniedMessage());
    }
  }

  private OrganizationContext resolveOnce(HttpServletRequest request) {
    Optional<OrganizationContext> existing = RequestScopes.currentContext(request);
    if (existing.isPresent()) {
      return existing.get();
    }
    var session = sessionProvider.currentSession().orElseThrow(UnauthenticatedException::new);
    var context = resolver.resolve(session, hintExtractor.extract(request, session));
    RequestScopes.bind(request, context);
    return context;
  }
}
