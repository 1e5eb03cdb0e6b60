package io.b2mash.orgguard.guard;

import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.rbac.AccessRequirement;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies {@link AccessGuard} to handlers carrying {@code @OrganizationScoped}, {@code
 * @RequiresRole} or {@code @RequiresPermission}. Denials propagate as exceptions and are rendered
 * by the global exception handler, so the handler never runs.
 */
@Component
public class AccessGuardInterceptor implements HandlerInterceptor {

  static final String MDC_ORGANIZATION_ID = "organizationId";
  static final String MDC_ROLE = "role";

  private final AccessGuard accessGuard;

  public AccessGuardInterceptor(AccessGuard accessGuard) {
    this.accessGuard = accessGuard;
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return true;
    }
    Optional<AccessRequirement> requirement = HandlerRequirements.of(handlerMethod);
    if (requirement.isEmpty()) {
      return true;
    }

    OrganizationContext context = accessGuard.authorize(request, requirement.get());
    MDC.put(MDC_ORGANIZATION_ID, context.organizationId());
    MDC.put(MDC_ROLE, context.role().name());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    MDC.remove(MDC_ORGANIZATION_ID);
    MDC.remove(MDC_ROLE);
  }
}
