package io.b2mash.orgguard.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.exception.MissingOrganizationContextException;
import io.b2mash.orgguard.exception.NotAMemberException;
import io.b2mash.orgguard.member.Membership;
import io.b2mash.orgguard.member.MembershipStore;
import io.b2mash.orgguard.security.AuthenticatedSession;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrganizationContextResolverTest {

  private static final AuthenticatedSession SESSION =
      new AuthenticatedSession(
          new AuthenticatedSession.Subject("user_1", "Ada", "ada@example.com"), null);

  @Mock private MembershipStore membershipStore;

  private OrganizationContextResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new OrganizationContextResolver(membershipStore);
  }

  @Test
  void resolve_returnsStoredRole() {
    var membership = new Membership("user_1", "org_a", Role.TRAINER);
    when(membershipStore.findMembership("user_1", "org_a")).thenReturn(Optional.of(membership));

    var context = resolver.resolve(SESSION, new OrganizationHints(null, "org_a", null));

    assertThat(context.organizationId()).isEqualTo("org_a");
    assertThat(context.role()).isEqualTo(Role.TRAINER);
    assertThat(context.membership()).isEqualTo(membership);
    assertThat(context.subjectId()).isEqualTo("user_1");
  }

  @Test
  void resolve_usesHighestPrecedenceHintOnly() {
    when(membershipStore.findMembership("user_1", "org_session"))
        .thenReturn(Optional.of(new Membership("user_1", "org_session", Role.USER)));

    var context =
        resolver.resolve(SESSION, new OrganizationHints("org_session", "org_query", "org_path"));

    assertThat(context.organizationId()).isEqualTo("org_session");
    verify(membershipStore, never()).findMembership("user_1", "org_query");
    verify(membershipStore, never()).findMembership("user_1", "org_path");
  }

  @Test
  void resolve_withoutHints_throwsMissingOrganizationContext() {
    assertThatThrownBy(() -> resolver.resolve(SESSION, OrganizationHints.none()))
        .isInstanceOf(MissingOrganizationContextException.class);
    verify(membershipStore, never()).findMembership(anyString(), anyString());
  }

  @Test
  void resolve_withoutMembership_throwsNotAMember() {
    when(membershipStore.findMembership("user_1", "org_other")).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> resolver.resolve(SESSION, new OrganizationHints(null, null, "org_other")))
        .isInstanceOf(NotAMemberException.class);
  }

  @Test
  void resolve_isIdempotentAndReadsOncePerCall() {
    when(membershipStore.findMembership("user_1", "org_a"))
        .thenReturn(Optional.of(new Membership("user_1", "org_a", Role.OWNER)));
    var hints = new OrganizationHints("org_a", null, null);

    var first = resolver.resolve(SESSION, hints);
    var second = resolver.resolve(SESSION, hints);

    assertThat(first).isEqualTo(second);
    verify(membershipStore, times(2)).findMembership("user_1", "org_a");
  }

  @Test
  void isMember_andMembershipsOf_delegateToStore() {
    when(membershipStore.findMembership("user_1", "org_a"))
        .thenReturn(Optional.of(new Membership("user_1", "org_a", Role.USER)));
    when(membershipStore.findMembership("user_1", "org_b")).thenReturn(Optional.empty());
    when(membershipStore.findMembershipsForSubject("user_1"))
        .thenReturn(List.of(new Membership("user_1", "org_a", Role.USER)));

    assertThat(resolver.isMember("user_1", "org_a")).isTrue();
    assertThat(resolver.isMember("user_1", "org_b")).isFalse();
    assertThat(resolver.membershipsOf("user_1"))
        .extracting(Membership::organizationId)
        .containsExactly("org_a");
  }
}
