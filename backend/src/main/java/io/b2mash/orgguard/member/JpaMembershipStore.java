package io.b2mash.orgguard.member;

import io.b2mash.orgguard.api.Role;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Membership store over the {@code members} table. Each lookup is one read; nothing is cached. */
@Component
public class JpaMembershipStore implements MembershipStore {

  private static final Logger log = LoggerFactory.getLogger(JpaMembershipStore.class);

  private final MemberRepository memberRepository;

  public JpaMembershipStore(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Membership> findMembership(String subjectId, String organizationId) {
    return memberRepository
        .findBySubjectIdAndOrganizationId(subjectId, organizationId)
        .flatMap(JpaMembershipStore::toMembership);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Membership> findMembershipsForSubject(String subjectId) {
    return memberRepository.findBySubjectId(subjectId).stream()
        .map(JpaMembershipStore::toMembership)
        .flatMap(Optional::stream)
        .toList();
  }

  static Optional<Membership> toMembership(Member member) {
    Optional<Role> role = member.parsedRole();
    if (role.isEmpty()) {
      log.warn(
          "Ignoring membership with unknown role: subjectId={}, organizationId={}, role={}",
          member.getSubjectId(),
          member.getOrganizationId(),
          member.getRole());
      return Optional.empty();
    }
    return Optional.of(
        new Membership(member.getSubjectId(), member.getOrganizationId(), role.get()));
  }
}
