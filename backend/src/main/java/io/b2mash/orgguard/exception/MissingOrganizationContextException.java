package io.b2mash.orgguard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** None of the session, query or path hints named an organization. */
public class MissingOrganizationContextException extends ErrorResponseException {

  public static final String MESSAGE = "Organization ID is required";

  public MissingOrganizationContextException() {
    super(HttpStatus.BAD_REQUEST, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Missing organization context");
    problem.setDetail(MESSAGE);
    problem.setProperty("message", MESSAGE);
    return problem;
  }
}
