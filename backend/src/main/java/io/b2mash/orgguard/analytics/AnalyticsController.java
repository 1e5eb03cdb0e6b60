package io.b2mash.orgguard.analytics;

import io.b2mash.orgguard.analytics.AnalyticsService.AdminStats;
import io.b2mash.orgguard.analytics.AnalyticsService.MemberAnalytics;
import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.rbac.RequiresPermission;
import io.b2mash.orgguard.rbac.RequiresRole;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/gym")
public class AnalyticsController {

  private final AnalyticsService analyticsService;

  public AnalyticsController(AnalyticsService analyticsService) {
    this.analyticsService = analyticsService;
  }

  @GetMapping("/analytics")
  @RequiresPermission(Permission.VIEW_ANALYTICS)
  public ResponseEntity<MemberAnalytics> analytics(OrganizationContext context) {
    return ResponseEntity.ok(analyticsService.memberAnalytics(context.organizationId()));
  }

  @GetMapping("/admin/stats")
  @RequiresRole(Role.OWNER)
  public ResponseEntity<AdminStats> adminStats(OrganizationContext context) {
    return ResponseEntity.ok(analyticsService.adminStats(context.organizationId()));
  }
}
