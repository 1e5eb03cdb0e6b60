package io.b2mash.orgguard.security;

/**
 * A verified caller as reported by the session collaborator.
 *
 * @param subject who is calling
 * @param activeOrganizationId the organization recorded as active on the session, or null
 */
public record AuthenticatedSession(Subject subject, String activeOrganizationId) {

  public record Subject(String id, String name, String email) {}
}
