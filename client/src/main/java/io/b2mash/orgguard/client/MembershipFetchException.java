package io.b2mash.orgguard.client;

import java.util.OptionalInt;

/**
 * The membership summary could not be fetched. Carries the server's {@code message} when the error
 * body was readable, otherwise {@value MembershipClient#DEFAULT_ERROR_MESSAGE}.
 */
public class MembershipFetchException extends RuntimeException {

  private final Integer statusCode;

  public MembershipFetchException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public MembershipFetchException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  /** HTTP status of the failed response; empty when no response was received. */
  public OptionalInt getStatusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }
}
