package io.b2mash.orgguard.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RoleTest {

  @Test
  void fromValue_parsesKnownRoles() {
    assertThat(Role.fromValue("OWNER")).isEqualTo(Role.OWNER);
    assertThat(Role.fromValue("TRAINER")).isEqualTo(Role.TRAINER);
    assertThat(Role.fromValue("USER")).isEqualTo(Role.USER);
  }

  @Test
  void fromValue_unknownRole_throwsUnknownRole() {
    assertThatThrownBy(() -> Role.fromValue("owner"))
        .isInstanceOf(UnknownRoleException.class)
        .hasMessage("Unknown role: owner");
  }

  @Test
  void tryParse_nullOrUnknown_isEmpty() {
    assertThat(Role.tryParse(null)).isEmpty();
    assertThat(Role.tryParse("ADMIN")).isEmpty();
    assertThat(Role.tryParse("USER")).contains(Role.USER);
  }
}
