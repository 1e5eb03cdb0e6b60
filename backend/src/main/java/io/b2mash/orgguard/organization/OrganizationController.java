package io.b2mash.orgguard.organization;

import io.b2mash.orgguard.api.MembershipSummary.OrganizationInfo;
import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.rbac.OrganizationScoped;
import io.b2mash.orgguard.rbac.RequiresPermission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OrganizationController {

  private final OrganizationService organizationService;

  public OrganizationController(OrganizationService organizationService) {
    this.organizationService = organizationService;
  }

  @GetMapping("/api/gym/settings")
  @RequiresPermission(Permission.VIEW_SETTINGS)
  public ResponseEntity<Map<String, OrganizationInfo>> getSettings(OrganizationContext context) {
    return ResponseEntity.ok(Map.of("organization", organizationService.requireProfile(context)));
  }

  @PutMapping("/api/gym/settings")
  @RequiresPermission(Permission.MANAGE_SETTINGS)
  public ResponseEntity<UpdateSettingsResponse> updateSettings(
      OrganizationContext context, @Valid @RequestBody UpdateSettingsRequest request) {
    var organization =
        organizationService.updateSettings(
            context, request.name(), request.slug(), request.logo());
    return ResponseEntity.ok(
        new UpdateSettingsResponse(organization, "Settings updated successfully"));
  }

  /**
   * Any member of the organization named in the path. The path variable is the lowest-precedence
   * hint: a session with an active organization still resolves to that one.
   */
  @GetMapping("/api/organizations/{organizationId}/overview")
  @OrganizationScoped
  public ResponseEntity<OverviewResponse> overview(
      @PathVariable String organizationId, OrganizationContext context) {
    return ResponseEntity.ok(
        new OverviewResponse(
            context.organizationId(),
            context.role(),
            organizationService.findProfile(context.organizationId()).orElse(null)));
  }

  public record UpdateSettingsRequest(
      @Size(min = 1, max = 255, message = "name must not be empty") String name,
      @Size(min = 1, max = 255, message = "slug must not be empty") String slug,
      @Pattern(regexp = "https?://.+", message = "logo must be a URL") String logo) {}

  public record UpdateSettingsResponse(OrganizationInfo organization, String message) {}

  public record OverviewResponse(String organizationId, Role role, OrganizationInfo organization) {}
}
