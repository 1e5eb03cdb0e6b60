package io.b2mash.orgguard.organization;

import static io.b2mash.orgguard.testutil.TestJwts.activeIn;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.orgguard.member.MemberRepository;
import io.b2mash.orgguard.testutil.TestOrganizations;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class OrganizationSettingsIntegrationTest {

  private static final String ORG_ID = "org_settings_test";

  @Autowired private MockMvc mockMvc;
  @Autowired private OrganizationRepository organizationRepository;
  @Autowired private MemberRepository memberRepository;

  @BeforeAll
  void setup() {
    TestOrganizations.organization(organizationRepository, ORG_ID, "Settings Gym");
    TestOrganizations.member(memberRepository, ORG_ID, "settings_owner", "OWNER");
    TestOrganizations.member(memberRepository, ORG_ID, "settings_trainer", "TRAINER");
    TestOrganizations.member(memberRepository, ORG_ID, "settings_user", "USER");
  }

  @Test
  void user_readsSettings() throws Exception {
    mockMvc
        .perform(get("/api/gym/settings").with(activeIn("settings_user", ORG_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.organization.id").value(ORG_ID))
        .andExpect(jsonPath("$.organization.slug").value("org-settings-test"));
  }

  @Test
  void owner_updatesLogo() throws Exception {
    mockMvc
        .perform(
            put("/api/gym/settings")
                .with(activeIn("settings_owner", ORG_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"logo\": \"https://cdn.test.example/logo.png\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.organization.logo").value("https://cdn.test.example/logo.png"))
        .andExpect(jsonPath("$.organization.name").value("Settings Gym"))
        .andExpect(jsonPath("$.message").value("Settings updated successfully"));
  }

  @Test
  void updateSettings_invalidLogo_isBadRequest() throws Exception {
    mockMvc
        .perform(
            put("/api/gym/settings")
                .with(activeIn("settings_owner", ORG_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"logo\": \"not a url\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void trainer_readsAnalytics() throws Exception {
    mockMvc
        .perform(get("/api/gym/analytics").with(activeIn("settings_trainer", ORG_ID)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.memberCount").value(3))
        .andExpect(jsonPath("$.roleDistribution.OWNER").value(1))
        .andExpect(jsonPath("$.roleDistribution.TRAINER").value(1))
        .andExpect(jsonPath("$.roleDistribution.USER").value(1));
  }
}
