package io.b2mash.orgguard.rbac;

import static io.b2mash.orgguard.api.Permission.ASSIGN_TRAINERS;
import static io.b2mash.orgguard.api.Permission.ASSIGN_WORKOUTS;
import static io.b2mash.orgguard.api.Permission.CREATE_WORKOUTS;
import static io.b2mash.orgguard.api.Permission.DELETE_ORGANIZATION;
import static io.b2mash.orgguard.api.Permission.DELETE_WORKOUTS;
import static io.b2mash.orgguard.api.Permission.EDIT_WORKOUTS;
import static io.b2mash.orgguard.api.Permission.INVITE_MEMBERS;
import static io.b2mash.orgguard.api.Permission.MANAGE_BILLING;
import static io.b2mash.orgguard.api.Permission.MANAGE_MEMBERS;
import static io.b2mash.orgguard.api.Permission.MANAGE_ORGANIZATION;
import static io.b2mash.orgguard.api.Permission.MANAGE_SCHEDULE;
import static io.b2mash.orgguard.api.Permission.MANAGE_SETTINGS;
import static io.b2mash.orgguard.api.Permission.MANAGE_TRAINERS;
import static io.b2mash.orgguard.api.Permission.MANAGE_USERS;
import static io.b2mash.orgguard.api.Permission.REMOVE_MEMBERS;
import static io.b2mash.orgguard.api.Permission.VIEW_ANALYTICS;
import static io.b2mash.orgguard.api.Permission.VIEW_BILLING;
import static io.b2mash.orgguard.api.Permission.VIEW_MEMBERS;
import static io.b2mash.orgguard.api.Permission.VIEW_ORGANIZATION;
import static io.b2mash.orgguard.api.Permission.VIEW_REPORTS;
import static io.b2mash.orgguard.api.Permission.VIEW_SCHEDULE;
import static io.b2mash.orgguard.api.Permission.VIEW_SETTINGS;
import static io.b2mash.orgguard.api.Permission.VIEW_USERS;
import static io.b2mash.orgguard.api.Permission.VIEW_WORKOUTS;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import java.util.List;

/**
 * The role to permission table and the role hierarchy. This is the only place that knows what a
 * role may do; both the request guard and the membership summary read from here.
 *
 * <p>Both lookups switch exhaustively over {@link Role}, so adding a role without a permission
 * entry and a rank does not compile.
 */
public final class RolePermissions {

  private static final List<Permission> OWNER_PERMISSIONS =
      List.of(
          MANAGE_ORGANIZATION,
          VIEW_ORGANIZATION,
          DELETE_ORGANIZATION,
          MANAGE_MEMBERS,
          INVITE_MEMBERS,
          REMOVE_MEMBERS,
          VIEW_MEMBERS,
          MANAGE_TRAINERS,
          ASSIGN_TRAINERS,
          MANAGE_USERS,
          VIEW_USERS,
          CREATE_WORKOUTS,
          EDIT_WORKOUTS,
          DELETE_WORKOUTS,
          VIEW_WORKOUTS,
          ASSIGN_WORKOUTS,
          MANAGE_SCHEDULE,
          VIEW_SCHEDULE,
          VIEW_ANALYTICS,
          VIEW_REPORTS,
          MANAGE_BILLING,
          VIEW_BILLING,
          MANAGE_SETTINGS,
          VIEW_SETTINGS);

  private static final List<Permission> TRAINER_PERMISSIONS =
      List.of(
          VIEW_ORGANIZATION,
          VIEW_MEMBERS,
          VIEW_USERS,
          CREATE_WORKOUTS,
          EDIT_WORKOUTS,
          DELETE_WORKOUTS,
          VIEW_WORKOUTS,
          ASSIGN_WORKOUTS,
          MANAGE_SCHEDULE,
          VIEW_SCHEDULE,
          VIEW_ANALYTICS,
          VIEW_SETTINGS);

  private static final List<Permission> USER_PERMISSIONS =
      List.of(VIEW_ORGANIZATION, VIEW_WORKOUTS, VIEW_SCHEDULE, VIEW_SETTINGS);

  /** Permissions granted to the role, in table order. Empty for a null role. */
  public static List<Permission> permissionsFor(Role role) {
    if (role == null) {
      return List.of();
    }
    return switch (role) {
      case OWNER -> OWNER_PERMISSIONS;
      case TRAINER -> TRAINER_PERMISSIONS;
      case USER -> USER_PERMISSIONS;
    };
  }

  /** Strictly ordered rank: OWNER 3, TRAINER 2, USER 1. */
  public static int hierarchyRank(Role role) {
    return switch (role) {
      case OWNER -> 3;
      case TRAINER -> 2;
      case USER -> 1;
    };
  }

  private RolePermissions() {}
}
