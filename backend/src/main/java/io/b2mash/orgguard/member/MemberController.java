package io.b2mash.orgguard.member;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.rbac.RequiresPermission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/gym/members")
public class MemberController {

  private final MemberManagementService memberManagementService;

  public MemberController(MemberManagementService memberManagementService) {
    this.memberManagementService = memberManagementService;
  }

  @GetMapping
  @RequiresPermission(Permission.VIEW_MEMBERS)
  public ResponseEntity<MembersResponse> listMembers(OrganizationContext context) {
    var members =
        memberManagementService.listMembers(context).stream().map(MemberResponse::from).toList();
    return ResponseEntity.ok(new MembersResponse(members));
  }

  @PostMapping("/invite")
  @RequiresPermission(Permission.INVITE_MEMBERS)
  public ResponseEntity<InviteResponse> invite(
      OrganizationContext context, @Valid @RequestBody InviteRequest request) {
    var invitation = memberManagementService.invite(context, request.email(), request.role());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new InviteResponse(InvitationResponse.from(invitation), "Invitation sent"));
  }

  @PutMapping("/{subjectId}/role")
  @RequiresPermission(Permission.MANAGE_MEMBERS)
  public ResponseEntity<Membership> changeRole(
      OrganizationContext context,
      @PathVariable String subjectId,
      @Valid @RequestBody ChangeRoleRequest request) {
    var membership = memberManagementService.changeRole(context, subjectId, request.role());
    return ResponseEntity.ok(membership);
  }

  @DeleteMapping("/{subjectId}")
  @RequiresPermission(Permission.REMOVE_MEMBERS)
  public ResponseEntity<MessageResponse> removeMember(
      OrganizationContext context, @PathVariable String subjectId) {
    memberManagementService.removeMember(context, subjectId);
    return ResponseEntity.ok(new MessageResponse("Member removed successfully"));
  }

  public record InviteRequest(
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      @NotNull(message = "role is required") Role role) {}

  public record ChangeRoleRequest(@NotNull(message = "role is required") Role role) {}

  public record MembersResponse(List<MemberResponse> members) {}

  public record MemberResponse(
      UUID id, String subjectId, Role role, String name, String email, Instant createdAt) {

    public static MemberResponse from(Member member) {
      return new MemberResponse(
          member.getId(),
          member.getSubjectId(),
          member.parsedRole().orElseThrow(),
          member.getName(),
          member.getEmail(),
          member.getCreatedAt());
    }
  }

  public record InvitationResponse(
      UUID id, String email, String role, String status, Instant expiresAt) {

    public static InvitationResponse from(Invitation invitation) {
      return new InvitationResponse(
          invitation.getId(),
          invitation.getEmail(),
          invitation.getRole(),
          invitation.getStatus().name(),
          invitation.getExpiresAt());
    }
  }

  public record InviteResponse(InvitationResponse invitation, String message) {}

  public record MessageResponse(String message) {}
}
