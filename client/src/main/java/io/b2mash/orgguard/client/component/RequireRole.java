package io.b2mash.orgguard.client.component;

import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.client.MembershipMirror;
import io.b2mash.orgguard.client.PermissionChecks;
import java.util.List;
import java.util.function.Supplier;

/** Renders its content only for members holding one of the given roles. */
public final class RequireRole<T> extends GuardComponent<T, RequireRole<T>> {

  private final List<Role> roles;

  private RequireRole(MembershipMirror mirror, Supplier<T> content, List<Role> roles) {
    super(mirror, content);
    this.roles = roles;
  }

  public static <T> RequireRole<T> of(MembershipMirror mirror, Supplier<T> content, Role... roles) {
    return new RequireRole<>(mirror, content, List.of(roles));
  }

  @Override
  boolean isMet(MembershipSummary summary) {
    return PermissionChecks.hasRole(summary, roles);
  }

  @Override
  RequireRole<T> self() {
    return this;
  }
}
