package io.b2mash.orgguard.member;

import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.config.InvitationProperties;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.exception.ForbiddenException;
import io.b2mash.orgguard.exception.ResourceNotFoundException;
import io.b2mash.orgguard.rbac.PermissionEvaluator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Invite, re-role and remove members of the caller's organization. The acting role and the
 * organization always come from the resolved {@link OrganizationContext}; every role transition is
 * re-checked with {@link PermissionEvaluator#canManageRole} before anything is written.
 */
@Service
public class MemberManagementService {

  private static final Logger log = LoggerFactory.getLogger(MemberManagementService.class);

  private final MemberRepository memberRepository;
  private final InvitationRepository invitationRepository;
  private final InvitationProperties invitationProperties;
  private final Clock clock;

  @Autowired
  public MemberManagementService(
      MemberRepository memberRepository,
      InvitationRepository invitationRepository,
      InvitationProperties invitationProperties) {
    this(memberRepository, invitationRepository, invitationProperties, Clock.systemUTC());
  }

  MemberManagementService(
      MemberRepository memberRepository,
      InvitationRepository invitationRepository,
      InvitationProperties invitationProperties,
      Clock clock) {
    this.memberRepository = memberRepository;
    this.invitationRepository = invitationRepository;
    this.invitationProperties = invitationProperties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<Member> listMembers(OrganizationContext context) {
    return memberRepository
        .findByOrganizationIdOrderByCreatedAtAsc(context.organizationId())
        .stream()
        .filter(member -> member.parsedRole().isPresent())
        .toList();
  }

  @Transactional
  public Invitation invite(OrganizationContext context, String email, Role role) {
    requireCanManage(context.role(), role, "invite");

    Instant expiresAt = clock.instant().plus(invitationProperties.ttl());
    var invitation =
        invitationRepository.save(
            new Invitation(
                context.organizationId(), email, role.name(), context.subjectId(), expiresAt));
    log.info(
        "Invited {} as {} to organization {} by {}",
        email,
        role,
        context.organizationId(),
        context.subjectId());
    return invitation;
  }

  @Transactional
  public Membership changeRole(OrganizationContext context, String targetSubjectId, Role newRole) {
    requireNotSelf(context, targetSubjectId);
    ManagedMember target = requireMember(context, targetSubjectId);
    Role currentRole = target.role();

    requireCanManage(context.role(), currentRole, "change the role of");
    requireCanManage(context.role(), newRole, "assign");

    target.row().changeRole(newRole.name());
    memberRepository.save(target.row());
    log.info(
        "Changed role of {} in organization {} from {} to {} by {}",
        targetSubjectId,
        context.organizationId(),
        currentRole,
        newRole,
        context.subjectId());
    return new Membership(targetSubjectId, context.organizationId(), newRole);
  }

  @Transactional
  public void removeMember(OrganizationContext context, String targetSubjectId) {
    requireNotSelf(context, targetSubjectId);
    ManagedMember target = requireMember(context, targetSubjectId);
    Role targetRole = target.role();

    requireCanManage(context.role(), targetRole, "remove");

    memberRepository.delete(target.row());
    log.info(
        "Removed {} ({}) from organization {} by {}",
        targetSubjectId,
        targetRole,
        context.organizationId(),
        context.subjectId());
  }

  /** A row whose stored role is not a known {@link Role} is not a member and is reported as 404. */
  private ManagedMember requireMember(OrganizationContext context, String subjectId) {
    return memberRepository
        .findBySubjectIdAndOrganizationId(subjectId, context.organizationId())
        .flatMap(member -> member.parsedRole().map(role -> new ManagedMember(member, role)))
        .orElseThrow(() -> new ResourceNotFoundException("Member", subjectId));
  }

  private static void requireCanManage(Role actorRole, Role targetRole, String verb) {
    if (!PermissionEvaluator.canManageRole(actorRole, targetRole)) {
      throw new ForbiddenException(
          "Access denied. Role %s cannot %s members with role %s"
              .formatted(actorRole, verb, targetRole));
    }
  }

  private static void requireNotSelf(OrganizationContext context, String targetSubjectId) {
    if (context.subjectId().equals(targetSubjectId)) {
      throw new ForbiddenException("Access denied. Members cannot modify their own membership");
    }
  }

  private record ManagedMember(Member row, Role role) {}
}
