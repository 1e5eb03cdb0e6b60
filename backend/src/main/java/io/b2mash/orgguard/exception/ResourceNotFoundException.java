package io.b2mash.orgguard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A member or organization profile does not exist in the caller's organization. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, notFound(resourceType, String.valueOf(id)), null);
  }

  private static ProblemDetail notFound(String resourceType, String id) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, resourceType + " " + id + " does not exist in this organization");
    problem.setTitle(resourceType + " not found");
    problem.setProperty("message", resourceType + " not found");
    problem.setProperty("resourceId", id);
    return problem;
  }
}
