package io.b2mash.orgguard.organization;

import io.b2mash.orgguard.api.MembershipSummary.OrganizationInfo;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.exception.ResourceNotFoundException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OrganizationService {

  private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

  private final OrganizationRepository organizationRepository;

  public OrganizationService(OrganizationRepository organizationRepository) {
    this.organizationRepository = organizationRepository;
  }

  /** Profile of the organization, or empty if no organization row exists for the ID. */
  @Transactional(readOnly = true)
  public Optional<OrganizationInfo> findProfile(String organizationId) {
    return organizationRepository.findById(organizationId).map(OrganizationService::toInfo);
  }

  @Transactional(readOnly = true)
  public OrganizationInfo requireProfile(OrganizationContext context) {
    return findProfile(context.organizationId())
        .orElseThrow(
            () -> new ResourceNotFoundException("Organization", context.organizationId()));
  }

  /** Updates the caller's own organization; the ID comes from the resolved context only. */
  @Transactional
  public OrganizationInfo updateSettings(
      OrganizationContext context, String name, String slug, String logo) {
    var organization =
        organizationRepository
            .findById(context.organizationId())
            .orElseThrow(
                () -> new ResourceNotFoundException("Organization", context.organizationId()));
    organization.updateSettings(name, slug, logo);
    organizationRepository.save(organization);
    log.info(
        "Updated settings of organization {} by {}", context.organizationId(), context.subjectId());
    return toInfo(organization);
  }

  static OrganizationInfo toInfo(Organization organization) {
    return new OrganizationInfo(
        organization.getId(),
        organization.getName(),
        organization.getSlug(),
        organization.getLogo(),
        organization.getCreatedAt());
  }
}
