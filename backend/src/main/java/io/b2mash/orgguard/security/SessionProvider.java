package io.b2mash.orgguard.security;

import java.util.Optional;

/** Supplies the verified session for the current request, if any. */
public interface SessionProvider {

  Optional<AuthenticatedSession> currentSession();
}
