package io.b2mash.orgguard.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and revalidation settings for a {@link MembershipMirror}.
 *
 * @param baseUrl root URL of the backend, e.g. {@code https://api.example.com}
 * @param revalidateAfter age after which a read triggers a background refetch; defaults to 30s
 */
public record MirrorSettings(String baseUrl, Duration revalidateAfter) {

  public static final Duration DEFAULT_REVALIDATE_AFTER = Duration.ofSeconds(30);

  public MirrorSettings {
    Objects.requireNonNull(baseUrl, "baseUrl");
    if (revalidateAfter == null) {
      revalidateAfter = DEFAULT_REVALIDATE_AFTER;
    }
    if (revalidateAfter.isNegative() || revalidateAfter.isZero()) {
      throw new IllegalArgumentException("revalidateAfter must be positive: " + revalidateAfter);
    }
  }

  public static MirrorSettings of(String baseUrl) {
    return new MirrorSettings(baseUrl, DEFAULT_REVALIDATE_AFTER);
  }
}
