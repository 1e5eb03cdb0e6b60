package io.b2mash.orgguard.security;

import java.util.Map;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads session claims from a verified JWT. The active organization sits in a nested "o" claim.
 *
 * <p>Format: {@code { "sub": "user_123", "name": "...", "email": "...", "o": { "id": "org_xxx" } }}
 */
public final class SessionClaims {

  private static final String ORG_CLAIM = "o";

  /** Extracts the active organization ID ({@code o.id}), or null if absent or blank. */
  public static String extractActiveOrganizationId(Jwt jwt) {
    Object orgClaim = jwt.getClaim(ORG_CLAIM);
    if (orgClaim instanceof Map<?, ?> map) {
      Object value = map.get("id");
      if (value instanceof String str && !str.isBlank()) {
        return str;
      }
    }
    return null;
  }

  public static AuthenticatedSession toSession(Jwt jwt) {
    var subject =
        new AuthenticatedSession.Subject(
            jwt.getSubject(), jwt.getClaimAsString("name"), jwt.getClaimAsString("email"));
    return new AuthenticatedSession(subject, extractActiveOrganizationId(jwt));
  }

  private SessionClaims() {}
}
