package io.b2mash.orgguard.rbac;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * What a protected operation demands of the caller's resolved role. Evaluated by the request guard
 * and, through the membership summary, mirrored by the client.
 */
public interface AccessRequirement {

  boolean isSatisfiedBy(Role role);

  /** Human-readable denial, e.g. {@code Access denied. Required role: OWNER}. */
  String deniedMessage();

  /** The first clause the role fails, or empty if the role satisfies the whole requirement. */
  default Optional<AccessRequirement> firstUnmet(Role role) {
    return isSatisfiedBy(role) ? Optional.empty() : Optional.of(this);
  }

  /** Combines two requirements; both must pass. */
  default AccessRequirement and(AccessRequirement other) {
    var parts = new ArrayList<AccessRequirement>();
    parts.addAll(AllOf.flatten(this));
    parts.addAll(AllOf.flatten(other));
    return new AllOf(parts);
  }

  /** Any resolved member passes. */
  static AccessRequirement membership() {
    return Membership.INSTANCE;
  }

  static AccessRequirement anyRole(Role... roles) {
    return new AnyRole(List.of(roles));
  }

  static AccessRequirement anyPermission(Permission... permissions) {
    return permissions(Arrays.asList(permissions), false);
  }

  static AccessRequirement allPermissions(Permission... permissions) {
    return permissions(Arrays.asList(permissions), true);
  }

  static AccessRequirement permissions(Collection<Permission> permissions, boolean requireAll) {
    return new PermissionSet(List.copyOf(permissions), requireAll);
  }

  enum Membership implements AccessRequirement {
    INSTANCE;

    @Override
    public boolean isSatisfiedBy(Role role) {
      return role != null;
    }

    @Override
    public String deniedMessage() {
      return "User is not a member of this organization";
    }
  }

  record AnyRole(List<Role> roles) implements AccessRequirement {

    public AnyRole {
      roles = List.copyOf(roles);
    }

    @Override
    public boolean isSatisfiedBy(Role role) {
      return role != null && roles.contains(role);
    }

    @Override
    public String deniedMessage() {
      return "Access denied. Required role: " + join(roles, " or ");
    }
  }

  record PermissionSet(List<Permission> permissions, boolean requireAll)
      implements AccessRequirement {

    public PermissionSet {
      permissions = List.copyOf(permissions);
    }

    @Override
    public boolean isSatisfiedBy(Role role) {
      return requireAll
          ? PermissionEvaluator.hasAllPermissions(role, permissions)
          : PermissionEvaluator.hasAnyPermission(role, permissions);
    }

    @Override
    public String deniedMessage() {
      return "Access denied. Required permission: "
          + join(permissions, requireAll ? " and " : " or ");
    }
  }

  record AllOf(List<AccessRequirement> parts) implements AccessRequirement {

    public AllOf {
      parts = List.copyOf(parts);
    }

    @Override
    public boolean isSatisfiedBy(Role role) {
      return parts.stream().allMatch(part -> part.isSatisfiedBy(role));
    }

    @Override
    public Optional<AccessRequirement> firstUnmet(Role role) {
      return parts.stream().filter(part -> !part.isSatisfiedBy(role)).findFirst();
    }

    @Override
    public String deniedMessage() {
      return parts.stream().map(AccessRequirement::deniedMessage).collect(Collectors.joining("; "));
    }

    static List<AccessRequirement> flatten(AccessRequirement requirement) {
      if (requirement instanceof AllOf allOf) {
        return allOf.parts();
      }
      return List.of(requirement);
    }
  }

  private static String join(List<? extends Enum<?>> values, String separator) {
    return values.stream().map(Enum::name).collect(Collectors.joining(separator));
  }
}
