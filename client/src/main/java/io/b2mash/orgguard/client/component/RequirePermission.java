package io.b2mash.orgguard.client.component;

import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.client.MembershipMirror;
import io.b2mash.orgguard.client.PermissionChecks;
import java.util.List;
import java.util.function.Supplier;

/**
 * Renders its content when the member holds any of the given permissions, or all of them after
 * {@link #requireAll()}.
 */
public final class RequirePermission<T> extends GuardComponent<T, RequirePermission<T>> {

  private final List<Permission> permissions;
  private boolean requireAll;

  private RequirePermission(
      MembershipMirror mirror, Supplier<T> content, List<Permission> permissions) {
    super(mirror, content);
    this.permissions = permissions;
  }

  public static <T> RequirePermission<T> of(
      MembershipMirror mirror, Supplier<T> content, Permission... permissions) {
    return new RequirePermission<>(mirror, content, List.of(permissions));
  }

  public RequirePermission<T> requireAll() {
    this.requireAll = true;
    return this;
  }

  @Override
  boolean isMet(MembershipSummary summary) {
    return PermissionChecks.hasPermission(summary, permissions, requireAll);
  }

  @Override
  RequirePermission<T> self() {
    return this;
  }
}
