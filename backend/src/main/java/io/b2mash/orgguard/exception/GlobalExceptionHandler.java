package io.b2mash.orgguard.exception;

import io.b2mash.orgguard.context.OrganizationContextNotBoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    problem.setProperty("message", "Access denied");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    logDenial(request, ex.getDeniedMessage());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(NotAMemberException.class)
  public ResponseEntity<ProblemDetail> handleNotAMember(
      NotAMemberException ex, HttpServletRequest request) {
    logDenial(request, "not_a_member organizationId=" + ex.getOrganizationId());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(MissingOrganizationContextException.class)
  public ResponseEntity<ProblemDetail> handleMissingOrganization(
      MissingOrganizationContextException ex, HttpServletRequest request) {
    logDenial(request, "missing_organization_context");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ProblemDetail> handleUnauthenticated(
      UnauthenticatedException ex, HttpServletRequest request) {
    logDenial(request, "unauthenticated");
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ex.getBody());
  }

  @ExceptionHandler(OrganizationContextNotBoundException.class)
  public ResponseEntity<ProblemDetail> handleContextNotBound(
      OrganizationContextNotBoundException ex) {
    log.error("Organization context invariant violation: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Organization context not available");
    problem.setDetail("Unable to resolve organization context for request");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  private void logDenial(HttpServletRequest request, String reason) {
    log.warn(
        "Denied: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        reason != null ? reason : "forbidden");
  }
}
