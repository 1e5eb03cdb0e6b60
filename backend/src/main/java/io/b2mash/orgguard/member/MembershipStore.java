package io.b2mash.orgguard.member;

import java.util.List;
import java.util.Optional;

/**
 * Read access to memberships. Implementations return typed roles only; a stored role that does not
 * parse is reported as no membership.
 */
public interface MembershipStore {

  Optional<Membership> findMembership(String subjectId, String organizationId);

  List<Membership> findMembershipsForSubject(String subjectId);
}
