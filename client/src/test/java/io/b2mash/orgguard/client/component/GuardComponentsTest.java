package io.b2mash.orgguard.client.component;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import io.b2mash.orgguard.client.MembershipClient;
import io.b2mash.orgguard.client.MembershipFetchException;
import io.b2mash.orgguard.client.MembershipMirror;
import io.b2mash.orgguard.client.MembershipSnapshot;
import io.b2mash.orgguard.client.MirrorSettings;
import io.b2mash.orgguard.client.MirrorStatus;
import io.b2mash.orgguard.client.SummaryFixtures;
import org.junit.jupiter.api.Test;

class GuardComponentsTest {

  @Test
  void loading_rendersPlaceholderOrNothing() {
    var mirror = mirrorIn(MembershipSnapshot.loading());

    var withPlaceholder =
        RequireRole.of(mirror, () -> "admin panel", Role.OWNER).loading(() -> "spinner");
    var withoutPlaceholder = RequireRole.of(mirror, () -> "admin panel", Role.OWNER);

    assertThat(withPlaceholder.render()).contains("spinner");
    assertThat(withoutPlaceholder.render()).isEmpty();
  }

  @Test
  void firstRender_startsTheSharedFetch() {
    var mirror = mirrorIn(MembershipSnapshot.loading());
    var component = RequireRole.of(mirror, () -> "admin panel", Role.OWNER);

    component.render();
    component.render();

    verify(mirror, times(1)).load();
  }

  @Test
  void ready_roleMet_rendersContent() {
    var mirror = mirrorIn(MembershipSnapshot.ready(SummaryFixtures.owner()));

    assertThat(
            RequireRole.of(mirror, () -> "admin panel", Role.OWNER)
                .fallback(() -> "no access")
                .render())
        .contains("admin panel");
  }

  @Test
  void ready_roleUnmet_rendersFallbackOrNothing() {
    var mirror = mirrorIn(MembershipSnapshot.ready(SummaryFixtures.user()));

    assertThat(
            RequireRole.of(mirror, () -> "admin panel", Role.OWNER)
                .fallback(() -> "no access")
                .render())
        .contains("no access");
    assertThat(RequireRole.of(mirror, () -> "admin panel", Role.OWNER).render()).isEmpty();
  }

  @Test
  void permission_anyOfByDefault_allOfWhenRequired() {
    var mirror = mirrorIn(MembershipSnapshot.ready(SummaryFixtures.trainer()));

    var anyOf =
        RequirePermission.of(
            mirror, () -> "content", Permission.MANAGE_BILLING, Permission.CREATE_WORKOUTS);
    var allOf =
        RequirePermission.of(
                mirror, () -> "content", Permission.MANAGE_BILLING, Permission.CREATE_WORKOUTS)
            .requireAll()
            .fallback(() -> "fallback");

    assertThat(anyOf.render()).contains("content");
    assertThat(allOf.render()).contains("fallback");
  }

  @Test
  void trainer_requireAllCreateAndAssign_rendersContent() {
    var mirror = mirrorIn(MembershipSnapshot.ready(SummaryFixtures.trainer()));

    var component =
        RequirePermission.of(
                mirror, () -> "content", Permission.CREATE_WORKOUTS, Permission.ASSIGN_WORKOUTS)
            .requireAll();

    assertThat(component.render()).contains("content");
  }

  @Test
  void error_withoutErrorUi_isTreatedAsUnmet() {
    var mirror =
        mirrorIn(
            MembershipSnapshot.failed(
                new MembershipFetchException(500, "Failed to fetch membership"),
                SummaryFixtures.owner()));

    var component =
        RequirePermission.of(mirror, () -> "content", Permission.VIEW_WORKOUTS)
            .fallback(() -> "fallback");

    assertThat(component.render()).contains("fallback");
  }

  @Test
  void error_withErrorUi_rendersErrorUi() {
    var mirror =
        mirrorIn(
            MembershipSnapshot.failed(
                new MembershipFetchException(500, "Failed to fetch membership"), null));

    var component =
        RequireRole.of(mirror, () -> "content", Role.USER)
            .fallback(() -> "fallback")
            .error(() -> "could not load membership");

    assertThat(component.render()).contains("could not load membership");
  }

  @Test
  void settledMirror_rendersContentForGrantedPermission() {
    var client = mock(MembershipClient.class);
    when(client.fetchMembership()).thenReturn(SummaryFixtures.user());
    var mirror = new MembershipMirror(client, MirrorSettings.of("http://localhost:8080"));

    var component =
        RequirePermission.of(mirror, () -> "workouts", Permission.VIEW_WORKOUTS)
            .loading(() -> "loading");

    mirror.load().join();

    assertThat(mirror.status()).isEqualTo(MirrorStatus.READY);
    assertThat(component.render()).contains("workouts");
  }

  private static MembershipMirror mirrorIn(MembershipSnapshot snapshot) {
    MembershipMirror mirror = mock(MembershipMirror.class);
    when(mirror.snapshot()).thenReturn(snapshot);
    return mirror;
  }
}
