package io.b2mash.orgguard.client;

import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Permission decisions over an already-fetched {@link MembershipSummary}. Reads only the summary's
 * {@code can} map and role; a {@code null} summary denies everything.
 *
 * <p>Any-of semantics over an empty list deny and all-of semantics over an empty list allow,
 * matching the server's evaluator.
 */
public final class PermissionChecks {

  private PermissionChecks() {}

  public static boolean hasPermission(MembershipSummary summary, Permission permission) {
    return summary != null && permission != null && summary.grants(permission);
  }

  public static boolean hasPermission(
      MembershipSummary summary, Collection<Permission> permissions, boolean requireAll) {
    if (summary == null || permissions == null) {
      return false;
    }
    return requireAll
        ? permissions.stream().allMatch(summary::grants)
        : permissions.stream().anyMatch(summary::grants);
  }

  public static boolean hasAnyPermission(MembershipSummary summary, Permission... permissions) {
    return hasPermission(summary, Arrays.asList(permissions), false);
  }

  public static boolean hasAllPermissions(MembershipSummary summary, Permission... permissions) {
    return hasPermission(summary, Arrays.asList(permissions), true);
  }

  public static boolean hasRole(MembershipSummary summary, Collection<Role> roles) {
    return summary != null
        && summary.role() != null
        && roles != null
        && roles.contains(summary.role());
  }

  public static boolean hasRole(MembershipSummary summary, Role... roles) {
    return hasRole(summary, Arrays.asList(roles));
  }

  public static List<Permission> listPermissions(MembershipSummary summary) {
    return summary == null ? List.of() : summary.permissions();
  }
}
