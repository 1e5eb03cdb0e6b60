package io.b2mash.orgguard.testutil;

import io.b2mash.orgguard.member.Member;
import io.b2mash.orgguard.member.MemberRepository;
import io.b2mash.orgguard.organization.Organization;
import io.b2mash.orgguard.organization.OrganizationRepository;

/** Seeds organizations and members straight through the repositories. */
public final class TestOrganizations {

  private TestOrganizations() {}

  public static Organization organization(
      OrganizationRepository repository, String organizationId, String name) {
    var slug = organizationId.replace('_', '-');
    return repository.save(new Organization(organizationId, name, slug));
  }

  public static Member member(
      MemberRepository repository, String organizationId, String subjectId, String role) {
    return repository.save(
        new Member(
            subjectId, organizationId, role, "Test " + subjectId, subjectId + "@test.example"));
  }
}
