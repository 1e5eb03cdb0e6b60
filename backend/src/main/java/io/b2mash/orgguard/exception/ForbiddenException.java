package io.b2mash.orgguard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The caller is a member of the organization but fails the operation's requirement. The denied
 * message (e.g. {@code Access denied. Required role: OWNER}) is both the problem detail and the
 * top-level {@code message} field clients read.
 */
public class ForbiddenException extends ErrorResponseException {

  private static final String TITLE = "Access denied";

  private final String deniedMessage;

  public ForbiddenException(String deniedMessage) {
    super(HttpStatus.FORBIDDEN, accessDenied(deniedMessage), null);
    this.deniedMessage = deniedMessage;
  }

  public String getDeniedMessage() {
    return deniedMessage;
  }

  private static ProblemDetail accessDenied(String deniedMessage) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.FORBIDDEN, deniedMessage);
    problem.setTitle(TITLE);
    problem.setProperty("message", deniedMessage);
    return problem;
  }
}
