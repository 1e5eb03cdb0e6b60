package io.b2mash.orgguard.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * A subject's tier within one organization. The constant name is also the wire value stored in
 * {@code members.role} and sent in the membership summary.
 */
public enum Role {
  OWNER,
  TRAINER,
  USER;

  @JsonValue
  public String value() {
    return name();
  }

  /** Parses a stored or transported role string. Throws {@link UnknownRoleException} if unknown. */
  @JsonCreator
  public static Role fromValue(String value) {
    return tryParse(value).orElseThrow(() -> new UnknownRoleException(value));
  }

  public static Optional<Role> tryParse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(role -> role.name().equals(value)).findFirst();
  }
}
