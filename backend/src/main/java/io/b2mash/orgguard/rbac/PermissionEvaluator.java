package io.b2mash.orgguard.rbac;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import java.util.Collection;

/**
 * Pure permission and hierarchy checks over {@link RolePermissions}. Nothing here throws: a null
 * role holds no permissions and fails every predicate.
 */
public final class PermissionEvaluator {

  public static boolean hasPermission(Role role, Permission permission) {
    return permission != null && RolePermissions.permissionsFor(role).contains(permission);
  }

  /** OR semantics. False for an empty collection. */
  public static boolean hasAnyPermission(Role role, Collection<Permission> permissions) {
    return permissions.stream().anyMatch(permission -> hasPermission(role, permission));
  }

  /** AND semantics. Vacuously true for an empty collection, even for a null role. */
  public static boolean hasAllPermissions(Role role, Collection<Permission> permissions) {
    return permissions.stream().allMatch(permission -> hasPermission(role, permission));
  }

  /** True if the actor ranks at or above the target. */
  public static boolean hierarchyAtLeast(Role actorRole, Role targetRole) {
    if (actorRole == null || targetRole == null) {
      return false;
    }
    return RolePermissions.hierarchyRank(actorRole) >= RolePermissions.hierarchyRank(targetRole);
  }

  /**
   * Whether {@code managerRole} may invite, re-role or remove a member holding {@code targetRole}.
   * OWNER manages everyone, TRAINER manages USER only, USER manages nobody.
   */
  public static boolean canManageRole(Role managerRole, Role targetRole) {
    if (managerRole == null || targetRole == null) {
      return false;
    }
    return switch (managerRole) {
      case OWNER -> true;
      case TRAINER -> targetRole == Role.USER;
      case USER -> false;
    };
  }

  /**
   * Whether {@code actorRole} may perform {@code action} on a member holding {@code targetRole}.
   * Requires {@link #hierarchyAtLeast}; then OWNER may do anything and TRAINER may only view or
   * edit a USER. Overlaps with {@link #canManageRole} but is a distinct relation.
   */
  public static boolean canPerformAction(Role actorRole, Role targetRole, MemberAction action) {
    if (action == null || !hierarchyAtLeast(actorRole, targetRole)) {
      return false;
    }
    return switch (actorRole) {
      case OWNER -> true;
      case TRAINER ->
          targetRole == Role.USER && (action == MemberAction.VIEW || action == MemberAction.EDIT);
      case USER -> false;
    };
  }

  private PermissionEvaluator() {}
}
