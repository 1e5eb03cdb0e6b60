package io.b2mash.orgguard.context;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Candidate organization IDs for one request, in precedence order: the session's active
 * organization, then the query parameter, then the path variable. The first non-blank hint wins and
 * hints are never merged.
 */
public record OrganizationHints(
    String sessionOrganizationId, String queryOrganizationId, String pathOrganizationId) {

  public static OrganizationHints none() {
    return new OrganizationHints(null, null, null);
  }

  public Optional<String> resolve() {
    return Stream.of(sessionOrganizationId, queryOrganizationId, pathOrganizationId)
        .filter(hint -> hint != null && !hint.isBlank())
        .findFirst();
  }
}
