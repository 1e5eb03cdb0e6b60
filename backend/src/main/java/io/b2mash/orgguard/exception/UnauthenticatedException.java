package io.b2mash.orgguard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class UnauthenticatedException extends ErrorResponseException {

  public static final String MESSAGE = "Unauthorized";

  public UnauthenticatedException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  /** The 401 body, also written by the security entry point before a handler is reached. */
  public static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle(MESSAGE);
    problem.setDetail("No authenticated session");
    problem.setProperty("message", MESSAGE);
    return problem;
  }
}
