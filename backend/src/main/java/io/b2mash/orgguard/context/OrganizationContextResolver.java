package io.b2mash.orgguard.context;

import io.b2mash.orgguard.exception.MissingOrganizationContextException;
import io.b2mash.orgguard.exception.NotAMemberException;
import io.b2mash.orgguard.member.Membership;
import io.b2mash.orgguard.member.MembershipStore;
import io.b2mash.orgguard.security.AuthenticatedSession;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Establishes the caller's organization and role. This is the only path by which a role is attached
 * to an operation; client-supplied role values are never read.
 *
 * <p>Each call performs one membership read and caches nothing. Callers that need the context more
 * than once in a request must pass the resolved {@link OrganizationContext} along.
 */
@Service
public class OrganizationContextResolver {

  private static final Logger log = LoggerFactory.getLogger(OrganizationContextResolver.class);

  private final MembershipStore membershipStore;

  public OrganizationContextResolver(MembershipStore membershipStore) {
    this.membershipStore = membershipStore;
  }

  /**
   * @throws MissingOrganizationContextException if no hint names an organization
   * @throws NotAMemberException if the subject has no membership in the chosen organization
   */
  public OrganizationContext resolve(AuthenticatedSession session, OrganizationHints hints) {
    String organizationId = hints.resolve().orElseThrow(MissingOrganizationContextException::new);
    String subjectId = session.subject().id();

    Membership membership =
        membershipStore
            .findMembership(subjectId, organizationId)
            .orElseThrow(() -> new NotAMemberException(organizationId));

    log.debug(
        "Resolved organization context: subjectId={}, organizationId={}, role={}",
        subjectId,
        organizationId,
        membership.role());
    return new OrganizationContext(session, organizationId, membership.role(), membership);
  }

  public boolean isMember(String subjectId, String organizationId) {
    return membershipStore.findMembership(subjectId, organizationId).isPresent();
  }

  public List<Membership> membershipsOf(String subjectId) {
    return membershipStore.findMembershipsForSubject(subjectId);
  }
}
