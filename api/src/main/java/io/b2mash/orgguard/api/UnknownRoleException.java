package io.b2mash.orgguard.api;

public class UnknownRoleException extends IllegalArgumentException {

  private final String value;

  public UnknownRoleException(String value) {
    super("Unknown role: " + value);
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
