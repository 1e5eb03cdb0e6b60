package io.b2mash.orgguard.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.config.GuardProperties;
import io.b2mash.orgguard.context.OrganizationContext;
import io.b2mash.orgguard.context.OrganizationContextResolver;
import io.b2mash.orgguard.context.RequestScopes;
import io.b2mash.orgguard.exception.ForbiddenException;
import io.b2mash.orgguard.exception.MissingOrganizationContextException;
import io.b2mash.orgguard.exception.NotAMemberException;
import io.b2mash.orgguard.exception.UnauthenticatedException;
import io.b2mash.orgguard.member.Membership;
import io.b2mash.orgguard.member.MembershipStore;
import io.b2mash.orgguard.rbac.AccessRequirement;
import io.b2mash.orgguard.security.AuthenticatedSession;
import io.b2mash.orgguard.security.SessionProvider;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;

@ExtendWith(MockitoExtension.class)
class AccessGuardTest {

  private static final String ORG_ID = "org_gym";

  @Mock private SessionProvider sessionProvider;
  @Mock private MembershipStore membershipStore;

  private AccessGuard guard;
  private MockHttpServletRequest request;
  private final AtomicInteger invocations = new AtomicInteger();

  @BeforeEach
  void setUp() {
    guard =
        new AccessGuard(
            sessionProvider,
            new OrganizationHintExtractor(new GuardProperties("organizationId", "organizationId")),
            new OrganizationContextResolver(membershipStore));
    request = new MockHttpServletRequest("GET", "/api/gym/workouts");
  }

  @Test
  void protect_allowedRole_invokesOperationWithContext() {
    signedIn("user_owner", ORG_ID);
    member("user_owner", Role.OWNER);

    var handler = guard.protect(AccessRequirement.anyRole(Role.OWNER), this::record);

    assertThat(handler.apply(request)).isEqualTo("user_owner@org_gym as OWNER");
    assertThat(invocations).hasValue(1);
  }

  @Test
  void protect_userAgainstOwnerOnly_forbiddenWithRoleMessage() {
    signedIn("user_plain", ORG_ID);
    member("user_plain", Role.USER);

    var handler = guard.protect(AccessRequirement.anyRole(Role.OWNER), this::record);

    assertThatThrownBy(() -> handler.apply(request))
        .isInstanceOf(ForbiddenException.class)
        .satisfies(
            e ->
                assertThat(((ForbiddenException) e).getBody().getProperties())
                    .containsEntry("message", "Access denied. Required role: OWNER"));
    assertThat(invocations).hasValue(0);
  }

  @Test
  void protect_trainerRequireAll_allowed() {
    signedIn("user_trainer", ORG_ID);
    member("user_trainer", Role.TRAINER);

    var handler =
        guard.protect(
            AccessRequirement.allPermissions(
                Permission.CREATE_WORKOUTS, Permission.ASSIGN_WORKOUTS),
            this::record);

    assertThat(handler.apply(request)).isEqualTo("user_trainer@org_gym as TRAINER");
  }

  @Test
  void protect_noSession_unauthenticatedBeforeAnyRead() {
    when(sessionProvider.currentSession()).thenReturn(Optional.empty());

    var handler = guard.protect(AccessRequirement.membership(), this::record);

    assertThatThrownBy(() -> handler.apply(request)).isInstanceOf(UnauthenticatedException.class);
    verify(membershipStore, never()).findMembership(any(), any());
    assertThat(invocations).hasValue(0);
  }

  @Test
  void protect_noHint_missingOrganizationContext() {
    signedIn("user_owner", null);

    var handler = guard.protect(AccessRequirement.membership(), this::record);

    assertThatThrownBy(() -> handler.apply(request))
        .isInstanceOf(MissingOrganizationContextException.class);
    assertThat(invocations).hasValue(0);
  }

  @Test
  void protect_notAMember_denied() {
    signedIn("user_stranger", ORG_ID);
    when(membershipStore.findMembership("user_stranger", ORG_ID)).thenReturn(Optional.empty());

    var handler = guard.protect(AccessRequirement.membership(), this::record);

    assertThatThrownBy(() -> handler.apply(request)).isInstanceOf(NotAMemberException.class);
    assertThat(invocations).hasValue(0);
  }

  @Test
  void authorize_readsQueryThenPathHints() {
    signedIn("user_owner", null);
    member("user_owner", Role.OWNER);
    request.setParameter("organizationId", ORG_ID);
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("organizationId", "org_path"));

    var context = guard.authorize(request, AccessRequirement.membership());

    assertThat(context.organizationId()).isEqualTo(ORG_ID);
  }

  @Test
  void authorize_resolvesOncePerRequest() {
    signedIn("user_owner", ORG_ID);
    member("user_owner", Role.OWNER);

    guard.authorize(request, AccessRequirement.membership());
    guard.authorize(request, AccessRequirement.anyPermission(Permission.MANAGE_BILLING));

    verify(membershipStore, times(1)).findMembership("user_owner", ORG_ID);
    assertThat(RequestScopes.currentContext(request)).isPresent();
  }

  private String record(OrganizationContext context) {
    invocations.incrementAndGet();
    return context.subjectId() + "@" + context.organizationId() + " as " + context.role();
  }

  private void signedIn(String subjectId, String activeOrganizationId) {
    when(sessionProvider.currentSession())
        .thenReturn(
            Optional.of(
                new AuthenticatedSession(
                    new AuthenticatedSession.Subject(subjectId, null, null),
                    activeOrganizationId)));
  }

  private void member(String subjectId, Role role) {
    when(membershipStore.findMembership(subjectId, ORG_ID))
        .thenReturn(Optional.of(new Membership(subjectId, ORG_ID, role)));
  }
}
