package io.b2mash.orgguard.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.orgguard.api.Permission;
import io.b2mash.orgguard.api.Role;
import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class MembershipClientTest {

  private static final String URL = "http://localhost:8080/api/me/membership";

  private static final String TRAINER_JSON =
      """
      {
        "subject": {"id": "user_ada", "name": "Ada", "email": "ada@example.com"},
        "member": {"subjectId": "user_ada", "organizationId": "org_gym", "role": "TRAINER"},
        "organization": {
          "id": "org_gym",
          "name": "Analytical Gym",
          "slug": "analytical-gym",
          "logo": null,
          "createdAt": "2024-01-01T00:00:00Z"
        },
        "role": "TRAINER",
        "permissions": ["VIEW_MEMBERS", "CREATE_WORKOUTS"],
        "can": {"VIEW_MEMBERS": true, "CREATE_WORKOUTS": true, "MANAGE_BILLING": false}
      }
      """;

  private MockRestServiceServer server;
  private MembershipClient client;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    client = new MembershipClient(builder, MirrorSettings.of("http://localhost:8080"));
  }

  @Test
  void fetchMembership_parsesSummary() {
    server
        .expect(requestTo(URL))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess(TRAINER_JSON, MediaType.APPLICATION_JSON));

    var summary = client.fetchMembership();

    assertThat(summary.role()).isEqualTo(Role.TRAINER);
    assertThat(summary.member().organizationId()).isEqualTo("org_gym");
    assertThat(summary.organization().createdAt())
        .isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(summary.permissions())
        .containsExactly(Permission.VIEW_MEMBERS, Permission.CREATE_WORKOUTS);
    assertThat(summary.grants(Permission.CREATE_WORKOUTS)).isTrue();
    assertThat(summary.grants(Permission.MANAGE_BILLING)).isFalse();
    server.verify();
  }

  @Test
  void fetchMembership_errorBodyWithMessage_surfacesMessage() {
    server
        .expect(requestTo(URL))
        .andRespond(
            withStatus(HttpStatus.FORBIDDEN)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(
                    "{\"title\":\"Not a member\","
                        + "\"message\":\"User is not a member of this organization\"}"));

    assertThatThrownBy(() -> client.fetchMembership())
        .isInstanceOf(MembershipFetchException.class)
        .hasMessage("User is not a member of this organization")
        .satisfies(
            e ->
                assertThat(((MembershipFetchException) e).getStatusCode())
                    .hasValue(HttpStatus.FORBIDDEN.value()));
  }

  @Test
  void fetchMembership_unparseableErrorBody_usesDefaultMessage() {
    server
        .expect(requestTo(URL))
        .andRespond(
            withStatus(HttpStatus.BAD_GATEWAY).contentType(MediaType.TEXT_PLAIN).body("upstream"));

    assertThatThrownBy(() -> client.fetchMembership())
        .isInstanceOf(MembershipFetchException.class)
        .hasMessage("Failed to fetch membership");
  }

  @Test
  void fetchMembership_errorBodyWithoutMessage_usesDefaultMessage() {
    server
        .expect(requestTo(URL))
        .andRespond(
            withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"boom\"}"));

    assertThatThrownBy(() -> client.fetchMembership())
        .isInstanceOf(MembershipFetchException.class)
        .hasMessage("Failed to fetch membership");
  }

  @Test
  void fetchMembership_ioFailure_wrapsWithoutStatus() {
    server.expect(requestTo(URL)).andRespond(withException(new IOException("connection refused")));

    assertThatThrownBy(() -> client.fetchMembership())
        .isInstanceOf(MembershipFetchException.class)
        .hasMessage("Failed to fetch membership")
        .hasRootCauseInstanceOf(IOException.class)
        .satisfies(e -> assertThat(((MembershipFetchException) e).getStatusCode()).isEmpty());
  }
}
