package io.b2mash.orgguard.client.component;

import io.b2mash.orgguard.api.MembershipSummary;
import io.b2mash.orgguard.client.MembershipMirror;
import io.b2mash.orgguard.client.MembershipSnapshot;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Chooses what to render from the mirror's current state. Precedence: loading placeholder while the
 * first fetch is pending; the error branch after a failed fetch if one was supplied, otherwise the
 * fallback; then content or fallback depending on the requirement. An absent branch renders
 * nothing.
 *
 * @param <T> whatever the caller renders, e.g. a view model or a template fragment
 * @param <S> the concrete component type, returned by the builder-style setters
 */
abstract class GuardComponent<T, S extends GuardComponent<T, S>> {

  private final MembershipMirror mirror;
  private final Supplier<T> content;
  private Supplier<T> fallback;
  private Supplier<T> loading;
  private Supplier<T> error;
  private boolean mounted;

  GuardComponent(MembershipMirror mirror, Supplier<T> content) {
    this.mirror = Objects.requireNonNull(mirror, "mirror");
    this.content = Objects.requireNonNull(content, "content");
  }

  abstract boolean isMet(MembershipSummary summary);

  abstract S self();

  /** Rendered once settled when the requirement is not met. */
  public S fallback(Supplier<T> fallback) {
    this.fallback = fallback;
    return self();
  }

  /** Rendered while the first fetch is pending. */
  public S loading(Supplier<T> loading) {
    this.loading = loading;
    return self();
  }

  /** Rendered after a failed fetch. Without it a failure renders the fallback. */
  public S error(Supplier<T> error) {
    this.error = error;
    return self();
  }

  /** The first call starts the shared fetch if nothing has started it yet. */
  public Optional<T> render() {
    if (!mounted) {
      mounted = true;
      mirror.load();
    }
    MembershipSnapshot snapshot = mirror.snapshot();
    return switch (snapshot.status()) {
      case LOADING -> supply(loading);
      case ERROR -> supply(error != null ? error : fallback);
      case READY -> supply(isMet(snapshot.summary()) ? content : fallback);
    };
  }

  private Optional<T> supply(Supplier<T> branch) {
    return branch == null ? Optional.empty() : Optional.ofNullable(branch.get());
  }
}
