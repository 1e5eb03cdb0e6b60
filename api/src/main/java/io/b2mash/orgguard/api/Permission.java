package io.b2mash.orgguard.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * A single granted capability. Permissions are opaque tags: the engine only tests set membership
 * and never interprets what a permission means.
 */
public enum Permission {
  // Organization management
  MANAGE_ORGANIZATION,
  VIEW_ORGANIZATION,
  DELETE_ORGANIZATION,

  // Member management
  MANAGE_MEMBERS,
  INVITE_MEMBERS,
  REMOVE_MEMBERS,
  VIEW_MEMBERS,

  // Trainer management
  MANAGE_TRAINERS,
  ASSIGN_TRAINERS,

  // User management
  MANAGE_USERS,
  VIEW_USERS,

  // Workouts
  CREATE_WORKOUTS,
  EDIT_WORKOUTS,
  DELETE_WORKOUTS,
  VIEW_WORKOUTS,
  ASSIGN_WORKOUTS,

  // Schedule
  MANAGE_SCHEDULE,
  VIEW_SCHEDULE,

  // Analytics and reports
  VIEW_ANALYTICS,
  VIEW_REPORTS,

  // Billing
  MANAGE_BILLING,
  VIEW_BILLING,

  // Settings
  MANAGE_SETTINGS,
  VIEW_SETTINGS;

  @JsonValue
  public String value() {
    return name();
  }

  @JsonCreator
  public static Permission fromValue(String value) {
    return Arrays.stream(values())
        .filter(permission -> permission.name().equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown permission: " + value));
  }
}
