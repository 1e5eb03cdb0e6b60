package io.b2mash.orgguard.me;

import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.api.MembershipSummary.MemberInfo;
import io.b2mash.orgguard.api.MembershipSummary.SubjectInfo;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.organization.OrganizationService;
import io.b2mash.orgguard.rbac.RolePermissions;
import org.springframework.stereotype.Service;

/**
 * Materializes the permission decision for the client. The summary carries the role's permissions
 * pre-evaluated so the client never needs the role/permission table.
 */
@Service
public class MembershipSummaryService {

  private final OrganizationService organizationService;

  public MembershipSummaryService(OrganizationService organizationService) {
    this.organizationService = organizationService;
  }

  public MembershipSummary summarize(OrganizationContext context) {
    var subject = context.session().subject();
    var membership = context.membership();
    return MembershipSummary.of(
        new SubjectInfo(subject.id(), subject.name(), subject.email()),
        new MemberInfo(membership.subjectId(), membership.organizationId(), membership.role()),
        organizationService.findProfile(context.organizationId()).orElse(null),
        context.role(),
        RolePermissions.permissionsFor(context.role()));
  }
}
