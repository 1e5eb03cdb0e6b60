package io.b2mash.orgguard.api;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Server-computed view of the current subject's membership in its active organization. The client
 * evaluates permissions against this payload only and never holds the role/permission table.
 *
 * <p>{@code permissions} is exactly the role's granted set; {@code can} holds an entry for every
 * known {@link Permission}, granted or not.
 */
public record MembershipSummary(
    SubjectInfo subject,
    MemberInfo member,
    OrganizationInfo organization,
    Role role,
    List<Permission> permissions,
    Map<Permission, Boolean> can) {

  public MembershipSummary {
    permissions = permissions == null ? List.of() : List.copyOf(permissions);
    can = can == null ? Map.of() : Collections.unmodifiableMap(copyOf(can));
  }

  /** Builds the summary, deriving {@code can} from {@code permissions} over every permission. */
  public static MembershipSummary of(
      SubjectInfo subject,
      MemberInfo member,
      OrganizationInfo organization,
      Role role,
      List<Permission> permissions) {
    var can = new EnumMap<Permission, Boolean>(Permission.class);
    for (Permission permission : Permission.values()) {
      can.put(permission, permissions.contains(permission));
    }
    return new MembershipSummary(subject, member, organization, role, permissions, can);
  }

  /** True only if {@code can} explicitly grants the permission. Missing entries count as denied. */
  public boolean grants(Permission permission) {
    return Boolean.TRUE.equals(can.get(permission));
  }

  private static Map<Permission, Boolean> copyOf(Map<Permission, Boolean> source) {
    var copy = new EnumMap<Permission, Boolean>(Permission.class);
    copy.putAll(source);
    return copy;
  }

  public record SubjectInfo(String id, String name, String email) {}

  public record MemberInfo(String subjectId, String organizationId, Role role) {}

  public record OrganizationInfo(
      String id, String name, String slug, String logo, Instant createdAt) {}
}
