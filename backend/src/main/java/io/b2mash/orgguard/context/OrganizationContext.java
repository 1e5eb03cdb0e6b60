package io.b2mash.orgguard.context;

import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.member.Membership;
import io.b2mash.orgguard.security.AuthenticatedSession;

/**
 * The resolved caller for one operation: who they are, which organization the operation runs in,
 * and the role they hold there. Role is only ever taken from the stored membership.
 */
public record OrganizationContext(
    AuthenticatedSession session, String organizationId, Role role, Membership membership) {

  public String subjectId() {
    return session.subject().id();
  }
}
