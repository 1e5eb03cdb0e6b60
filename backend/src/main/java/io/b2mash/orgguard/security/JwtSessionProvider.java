package io.b2mash.orgguard.security;

import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Session backed by the bearer JWT that Spring Security has already verified. */
@Component
public class JwtSessionProvider implements SessionProvider {

  @Override
  public Optional<AuthenticatedSession> currentSession() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication instanceof JwtAuthenticationToken jwtAuth
        && jwtAuth.isAuthenticated()
        && jwtAuth.getToken().getSubject() != null) {
      return Optional.of(SessionClaims.toSession(jwtAuth.getToken()));
    }
    return Optional.empty();
  }
}
