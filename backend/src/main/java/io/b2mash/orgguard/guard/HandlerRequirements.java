package io.b2mash.orgguard.guard;

import io.b2mash.orgguard.rbac.AccessRequirement;
import io.b2mash.orgguard.rbac.OrganizationScoped;
import io.b2mash.orgguard.rbac.RequiresPermission;
import io.b2mash.orgguard.rbac.RequiresRole;
import java.lang.reflect.AnnotatedElement;
import java.util.Arrays;
import java.util.Optional;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;

/**
 * Reads the guard annotations on a handler and its controller class into one combined {@link
 * AccessRequirement}. Class-level clauses come first.
 */
final class HandlerRequirements {

  static Optional<AccessRequirement> of(HandlerMethod handler) {
    Optional<AccessRequirement> typeLevel = fromElement(handler.getBeanType());
    Optional<AccessRequirement> methodLevel = fromElement(handler.getMethod());
    if (typeLevel.isPresent() && methodLevel.isPresent()) {
      return Optional.of(typeLevel.get().and(methodLevel.get()));
    }
    return typeLevel.isPresent() ? typeLevel : methodLevel;
  }

  private static Optional<AccessRequirement> fromElement(AnnotatedElement element) {
    AccessRequirement requirement = null;

    if (AnnotatedElementUtils.hasAnnotation(element, OrganizationScoped.class)) {
      requirement = AccessRequirement.membership();
    }

    RequiresRole roles = AnnotatedElementUtils.findMergedAnnotation(element, RequiresRole.class);
    if (roles != null) {
      requirement = combine(requirement, AccessRequirement.anyRole(roles.value()));
    }

    RequiresPermission permissions =
        AnnotatedElementUtils.findMergedAnnotation(element, RequiresPermission.class);
    if (permissions != null) {
      requirement =
          combine(
              requirement,
              AccessRequirement.permissions(
                  Arrays.asList(permissions.value()), permissions.requireAll()));
    }

    return Optional.ofNullable(requirement);
  }

  private static AccessRequirement combine(AccessRequirement current, AccessRequirement next) {
    if (current == null || current == AccessRequirement.membership()) {
      return next;
    }
    return current.and(next);
  }

  private HandlerRequirements() {}
}
