package io.b2mash.orgguard.me;

import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.context.OrganizationContextResolver;
import io.b2mash.orgguard.exception.UnauthenticatedException;
import io.b2mash.orgguard.member.Membership;
import io.b2mash.orgguard.rbac.OrganizationScoped;
import io.b2mash.orgguard.security.SessionProvider;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/me")
public class MeController {

  private final MembershipSummaryService summaryService;
  private final OrganizationContextResolver resolver;
  private final SessionProvider sessionProvider;

  public MeController(
      MembershipSummaryService summaryService,
      OrganizationContextResolver resolver,
      SessionProvider sessionProvider) {
    this.summaryService = summaryService;
    this.resolver = resolver;
    this.sessionProvider = sessionProvider;
  }

  /** The caller's membership in the organization resolved for this request. */
  @GetMapping("/membership")
  @OrganizationScoped
  public ResponseEntity<MembershipSummary> membership(OrganizationContext context) {
    return ResponseEntity.ok(summaryService.summarize(context));
  }

  /** Every organization the caller belongs to. Needs a session but no organization context. */
  @GetMapping("/organizations")
  public ResponseEntity<OrganizationsResponse> organizations() {
    var session = sessionProvider.currentSession().orElseThrow(UnauthenticatedException::new);
    return ResponseEntity.ok(
        new OrganizationsResponse(resolver.membershipsOf(session.subject().id())));
  }

  public record OrganizationsResponse(List<Membership> organizations) {}
}
