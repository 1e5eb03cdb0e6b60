package io.b2mash.orgguard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The subject holds no membership in the resolved organization. */
public class NotAMemberException extends ErrorResponseException {

  public static final String MESSAGE = "User is not a member of this organization";

  private final String organizationId;

  public NotAMemberException(String organizationId) {
    super(HttpStatus.FORBIDDEN, createProblem(), null);
    this.organizationId = organizationId;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Not a member");
    problem.setDetail(MESSAGE);
    problem.setProperty("message", MESSAGE);
    return problem;
  }
}
