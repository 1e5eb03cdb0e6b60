package io.b2mash.orgguard.context;

public class OrganizationContextNotBoundException extends RuntimeException {

  public OrganizationContextNotBoundException() {
    super("Organization context not available: handler is not guarded by the access interceptor");
  }
}
